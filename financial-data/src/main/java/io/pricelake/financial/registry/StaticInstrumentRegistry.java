package io.pricelake.financial.registry;

import io.pricelake.financial.model.InstrumentInfo;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Registry over a fixed id list, e.g. from the command line. Duplicates are dropped, order is kept.
 */
public class StaticInstrumentRegistry implements InstrumentRegistry {
    private final List<InstrumentInfo> instruments;

    public StaticInstrumentRegistry(List<String> ids) {
        this.instruments = new LinkedHashSet<>(ids).stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(InstrumentInfo::of)
                .toList();
    }

    @Override
    public List<InstrumentInfo> list() { return instruments; }
}
