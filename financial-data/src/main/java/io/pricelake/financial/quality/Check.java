package io.pricelake.financial.quality;

public enum Check {
    REQUIRED_COLUMN,
    COLUMN_TYPE,
    NOT_NULL,
    FINITE,
    UNIQUE_KEY,
    PARTITION_MEMBERSHIP
}
