package io.pricelake.error;

/**
 * An I/O failure against an external system (object store, database, price API) that may succeed on retry.
 */
public class TransientIoException extends PipelineException {
    public TransientIoException(String message) { super(message); }
    public TransientIoException(String message, Throwable cause) { super(message, cause); }
}
