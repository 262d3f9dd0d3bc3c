package io.pricelake.financial.load;

import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.PriceRow;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MetricsTable} over plain JDBC. The DDL sticks to types that PostgreSQL and H2 share.
 */
public class JdbcMetricsTable implements MetricsTable {
    private final ConnectionFactory connections;
    private final String table;

    public JdbcMetricsTable(ConnectionFactory connections, String table) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) throw new IllegalArgumentException("Bad table name: " + table);
        this.connections = connections;
        this.table = table;
    }

    public String table() { return table; }

    @Override
    public void ensureSchema() throws SQLException {
        try (Connection c = connections.open(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "ticker VARCHAR(32) NOT NULL, "
                    + "trade_date DATE NOT NULL, "
                    + "open DOUBLE PRECISION, "
                    + "high DOUBLE PRECISION, "
                    + "low DOUBLE PRECISION, "
                    + "close DOUBLE PRECISION, "
                    + "volume BIGINT, "
                    + "ingest_ts TIMESTAMP WITH TIME ZONE, "
                    + "daily_return DOUBLE PRECISION, "
                    + "rolling_vol DOUBLE PRECISION, "
                    + "PRIMARY KEY (ticker, trade_date))");
        }
    }

    @Override
    public Map<String, LocalDate> maxDatePerInstrument() throws SQLException {
        Map<String, LocalDate> marks = new HashMap<>();
        try (Connection c = connections.open();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT ticker, MAX(trade_date) FROM " + table + " GROUP BY ticker")) {
            while (rs.next()) marks.put(rs.getString(1), rs.getObject(2, LocalDate.class));
        }
        return marks;
    }

    @Override
    public LoadResult replace(String instrument, Collection<LocalDate> reloadDates, List<EnrichedRow> rows) throws SQLException {
        try (Connection c = connections.open()) {
            return Transactions.inTransaction(c, conn -> {
                int deleted = 0;
                try (PreparedStatement del = conn.prepareStatement("DELETE FROM " + table + " WHERE ticker = ? AND trade_date = ?")) {
                    for (LocalDate d : reloadDates) {
                        del.setString(1, instrument);
                        del.setObject(2, d);
                        deleted += del.executeUpdate();
                    }
                }
                int appended = 0;
                if (!rows.isEmpty()) {
                    String sql = "INSERT INTO " + table
                            + " (ticker, trade_date, open, high, low, close, volume, ingest_ts, daily_return, rolling_vol)"
                            + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
                    try (PreparedStatement ins = conn.prepareStatement(sql)) {
                        for (EnrichedRow r : rows) {
                            bind(ins, r);
                            ins.addBatch();
                        }
                        for (int n : ins.executeBatch()) appended += n == Statement.SUCCESS_NO_INFO ? 1 : n;
                    }
                }
                return new LoadResult(deleted, appended);
            });
        }
    }

    @Override
    public long countRows() throws SQLException {
        try (Connection c = connections.open();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static void bind(PreparedStatement ps, EnrichedRow r) throws SQLException {
        PriceRow p = r.price();
        ps.setString(1, p.instrument());
        ps.setObject(2, p.date());
        setDouble(ps, 3, p.open());
        setDouble(ps, 4, p.high());
        setDouble(ps, 5, p.low());
        setDouble(ps, 6, p.close());
        ps.setLong(7, p.volume());
        if (p.ingestTs() == null) ps.setNull(8, Types.TIMESTAMP_WITH_TIMEZONE);
        else ps.setObject(8, p.ingestTs().atOffset(ZoneOffset.UTC));
        setDouble(ps, 9, r.dailyReturn());
        setDouble(ps, 10, r.rollingVol());
    }

    private static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null || v.isNaN()) ps.setNull(idx, Types.DOUBLE);
        else ps.setDouble(idx, v);
    }
}
