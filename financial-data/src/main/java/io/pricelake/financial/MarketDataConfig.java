package io.pricelake.financial;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static io.pricelake.config.PipelineConfig.setting;

/**
 * Settings of the market data pipeline. {@link #fromEnv()} reads each value from a system property, then an
 * environment variable, then a default. When {@code POSTGRES_HOST} is set and no JDBC url is given, the url is
 * built from the {@code POSTGRES_*} variables.
 */
public record MarketDataConfig(
        Path storeRoot,
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String metricsTable,
        String instrumentsTable,
        LocalDate backfillStart,
        int rollingWindow,
        int provisionalDays,
        List<String> tickers,
        Path registryFile,
        long externalQps,
        Duration fetchTimeout,
        Path deadLetterFile
) {
    public MarketDataConfig {
        tickers = List.copyOf(tickers);
    }

    public static MarketDataConfig fromEnv() {
        Path root = Path.of(setting("pricelake.store.root", "PRICELAKE_STORE_ROOT", "pricelake-data/store"));
        String registry = setting("pricelake.registry.file", "PRICELAKE_REGISTRY_FILE", "");
        return new MarketDataConfig(
                root,
                defaultJdbcUrl(),
                blankToNull(setting("pricelake.jdbc.user", "POSTGRES_USER", "")),
                blankToNull(setting("pricelake.jdbc.password", "POSTGRES_PASSWORD", "")),
                setting("pricelake.table.metrics", "PRICELAKE_METRICS_TABLE", "stock_metrics"),
                setting("pricelake.table.instruments", "PRICELAKE_INSTRUMENTS_TABLE", "instruments"),
                LocalDate.parse(setting("pricelake.backfill.start", "PRICELAKE_BACKFILL_START", "2005-01-01")),
                Integer.parseInt(setting("pricelake.rolling.window", "PRICELAKE_ROLLING_WINDOW", "30")),
                Integer.parseInt(setting("pricelake.provisional.days", "PRICELAKE_PROVISIONAL_DAYS", "1")),
                splitList(setting("pricelake.tickers", "PRICELAKE_TICKERS", "SPY,AAPL,MSFT")),
                registry.isBlank() ? null : Path.of(registry),
                Long.parseLong(setting("pricelake.external.qps", "PRICELAKE_EXTERNAL_QPS", "5")),
                Duration.ofMillis(Long.parseLong(setting("pricelake.fetch.timeout.ms", "PRICELAKE_FETCH_TIMEOUT_MS", "30000"))),
                Path.of(setting("pricelake.deadletter.file", "PRICELAKE_DEADLETTER_FILE", "pricelake-data/dead-letters.jsonl")));
    }

    public MarketDataConfig withStoreRoot(Path p) {
        return new MarketDataConfig(p, jdbcUrl, jdbcUser, jdbcPassword, metricsTable, instrumentsTable, backfillStart,
                rollingWindow, provisionalDays, tickers, registryFile, externalQps, fetchTimeout, deadLetterFile);
    }

    public MarketDataConfig withJdbcUrl(String url) {
        return new MarketDataConfig(storeRoot, url, jdbcUser, jdbcPassword, metricsTable, instrumentsTable, backfillStart,
                rollingWindow, provisionalDays, tickers, registryFile, externalQps, fetchTimeout, deadLetterFile);
    }

    public MarketDataConfig withTickers(List<String> t, Path registry) {
        return new MarketDataConfig(storeRoot, jdbcUrl, jdbcUser, jdbcPassword, metricsTable, instrumentsTable, backfillStart,
                rollingWindow, provisionalDays, t, registry, externalQps, fetchTimeout, deadLetterFile);
    }

    public MarketDataConfig withBackfillStart(LocalDate d) {
        return new MarketDataConfig(storeRoot, jdbcUrl, jdbcUser, jdbcPassword, metricsTable, instrumentsTable, d,
                rollingWindow, provisionalDays, tickers, registryFile, externalQps, fetchTimeout, deadLetterFile);
    }

    private static String defaultJdbcUrl() {
        String explicit = setting("pricelake.jdbc.url", "PRICELAKE_JDBC_URL", "");
        if (!explicit.isBlank()) return explicit;
        String host = setting("pricelake.postgres.host", "POSTGRES_HOST", "");
        if (host.isBlank()) return "jdbc:h2:./pricelake-data/pricelake";
        return "jdbc:postgresql://" + host + ":" + setting("pricelake.postgres.port", "POSTGRES_PORT", "5432")
                + "/" + setting("pricelake.postgres.db", "POSTGRES_DB", "postgres");
    }

    static List<String> splitList(String csv) {
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
