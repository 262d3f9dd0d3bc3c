package io.pricelake.financial.model;

/**
 * Static metadata of a tradable instrument. Only {@code id} is needed by the pipeline.
 */
public record InstrumentInfo(String id, String name, String sector, String subIndustry, String headquarters) {
    public static InstrumentInfo of(String id) {
        return new InstrumentInfo(id, null, null, null, null);
    }
}
