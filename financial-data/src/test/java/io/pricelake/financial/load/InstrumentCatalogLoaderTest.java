package io.pricelake.financial.load;

import io.pricelake.financial.model.InstrumentInfo;
import io.pricelake.financial.registry.InstrumentRegistry;
import io.pricelake.financial.registry.StaticInstrumentRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentCatalogLoaderTest {
    private final ConnectionFactory db = H2.freshDatabase();
    private final InstrumentCatalogLoader loader = new InstrumentCatalogLoader(db, "instruments");

    @Test
    void replacesTableContents() throws Exception {
        assertEquals(3, loader.load(new StaticInstrumentRegistry(List.of("A", "B", "C"))));
        InstrumentRegistry second = () -> List.of(new InstrumentInfo("D", "Delta Corp", "Energy", "Oil", "Houston, Texas"));
        assertEquals(1, loader.load(second));

        assertEquals(1, H2.count(db, "SELECT COUNT(*) FROM instruments"));
        assertEquals(1, H2.count(db, "SELECT COUNT(*) FROM instruments WHERE sector = 'Energy'"));
    }

    @Test
    void emptyRegistryLeavesTableAlone() throws Exception {
        loader.load(new StaticInstrumentRegistry(List.of("A")));
        assertEquals(0, loader.load(List::of));
        assertEquals(1, H2.count(db, "SELECT COUNT(*) FROM instruments"));
    }
}
