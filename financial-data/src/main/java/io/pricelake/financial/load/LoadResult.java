package io.pricelake.financial.load;

/**
 * Rows removed and inserted by one load batch.
 */
public record LoadResult(int deleted, int appended) {}
