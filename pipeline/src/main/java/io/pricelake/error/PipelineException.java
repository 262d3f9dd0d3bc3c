package io.pricelake.error;

/**
 * Root of the pipeline's own exceptions.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) { super(message); }
    public PipelineException(String message, Throwable cause) { super(message, cause); }
}
