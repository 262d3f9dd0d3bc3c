package io.pricelake.financial.registry;

import io.pricelake.financial.model.InstrumentInfo;

import java.util.List;

/**
 * Read-only list of the instruments the pipeline tracks.
 */
public interface InstrumentRegistry {
    List<InstrumentInfo> list();

    default List<String> ids() {
        return list().stream().map(InstrumentInfo::id).toList();
    }
}
