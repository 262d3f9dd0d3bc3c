package io.pricelake.financial.model;

/**
 * Top-level object-store prefix of a partition family.
 */
public enum Domain {
    RAW("raw"),
    ENRICHED("enriched");

    private final String prefix;

    Domain(String prefix) { this.prefix = prefix; }

    public String prefix() { return prefix; }
}
