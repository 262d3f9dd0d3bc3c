package io.pricelake.financial.load;

import io.pricelake.financial.model.InstrumentInfo;
import io.pricelake.financial.registry.InstrumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Replaces the instrument reference table with the registry's contents in one transaction.
 */
public class InstrumentCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(InstrumentCatalogLoader.class);

    private final ConnectionFactory connections;
    private final String table;

    public InstrumentCatalogLoader(ConnectionFactory connections, String table) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) throw new IllegalArgumentException("Bad table name: " + table);
        this.connections = connections;
        this.table = table;
    }

    /**
     * @return rows written; 0 when the registry is empty, in which case the table is left untouched
     */
    public int load(InstrumentRegistry registry) throws SQLException {
        List<InstrumentInfo> instruments = registry.list();
        if (instruments.isEmpty()) {
            log.warn("No instruments to load into {}", table);
            return 0;
        }
        try (Connection c = connections.open()) {
            try (Statement s = c.createStatement()) {
                s.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                        + "ticker VARCHAR(32) PRIMARY KEY, "
                        + "name VARCHAR(255), "
                        + "sector VARCHAR(128), "
                        + "sub_industry VARCHAR(255), "
                        + "headquarters VARCHAR(255))");
            }
            int written = Transactions.inTransaction(c, conn -> {
                try (Statement s = conn.createStatement()) {
                    s.executeUpdate("DELETE FROM " + table);
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO " + table + " (ticker, name, sector, sub_industry, headquarters) VALUES (?, ?, ?, ?, ?)")) {
                    for (InstrumentInfo i : instruments) {
                        ps.setString(1, i.id());
                        ps.setString(2, i.name());
                        ps.setString(3, i.sector());
                        ps.setString(4, i.subIndustry());
                        ps.setString(5, i.headquarters());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                return instruments.size();
            });
            log.info("Loaded {} instruments into {}", written, table);
            return written;
        }
    }
}
