package io.pricelake.financial;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.util.Modules;
import io.pricelake.config.PipelineConfig;
import io.pricelake.financial.fetch.PriceFetcher;
import io.pricelake.financial.load.ConnectionFactory;
import io.pricelake.financial.load.MetricsTable;
import io.pricelake.financial.model.EnrichedRow;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.PriceRow;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.runtime.KeyedExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static io.pricelake.financial.TestData.row;
import static org.junit.jupiter.api.Assertions.*;

class MarketDataPipelineTest {
    @TempDir
    Path dir;

    private final FakePriceFetcher fetcher = new FakePriceFetcher();
    private Injector injector;
    private MarketDataPipeline pipeline;

    @BeforeEach
    void setUp() {
        MarketDataConfig config = new MarketDataConfig(dir.resolve("store"),
                "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", null, null,
                "stock_metrics", "instruments", LocalDate.of(2022, 1, 1), 30, 1, List.of("X"), null,
                0, Duration.ofSeconds(5), dir.resolve("dead-letters.jsonl"));
        PipelineConfig runtime = new PipelineConfig(4, Duration.ofSeconds(30), 2, 1, 5);
        injector = Guice.createInjector(Modules.override(new MarketDataModule(runtime, config)).with(new AbstractModule() {
            @Override
            protected void configure() {
                bind(PriceFetcher.class).toInstance(fetcher);
            }
        }));
        pipeline = injector.getInstance(MarketDataPipeline.class);
    }

    @AfterEach
    void tearDown() {
        injector.getInstance(KeyedExecutor.class).close();
    }

    private Object query(String sql, Object... args) throws SQLException {
        try (Connection c = injector.getInstance(ConnectionFactory.class).open();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) ps.setObject(i + 1, args[i]);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getObject(1);
            }
        }
    }

    @Test
    void fullYearForOneInstrumentLandsInTheTable() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2022, 6, 1), 252);
        fetcher.publish(TestData.series("X", days));
        LocalDate today = days.get(days.size() - 1);

        PipelineRunReport report = pipeline.run(today);

        assertFalse(report.hasFailures(), report.toString());
        MetricsTable table = injector.getInstance(MetricsTable.class);
        assertEquals(252, table.countRows());
        assertEquals(today, table.maxDatePerInstrument().get("X"));
        assertNull(query("SELECT daily_return FROM stock_metrics WHERE ticker = ? AND trade_date = ?", "X", days.get(0)));
        assertEquals(251L, ((Number) query("SELECT COUNT(daily_return) FROM stock_metrics WHERE ticker = ?", "X")).longValue());
    }

    @Test
    void firstDayOfTheYearGetsAReturnFromThePreviousYear() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2022, 12, 28), 4);
        fetcher.publish(TestData.series("X", days));
        pipeline.run(days.get(3));

        LocalDate firstOf2023 = days.stream().filter(d -> d.getYear() == 2023).findFirst().orElseThrow();
        assertNotNull(query("SELECT daily_return FROM stock_metrics WHERE trade_date = ?", firstOf2023));
    }

    @Test
    void revisedPriceForTodayReplacesTheProvisionalRow() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2023, 3, 1), 10);
        LocalDate today = days.get(9);
        fetcher.publish(TestData.series("X", days));
        pipeline.run(today);
        assertEquals(109.0, ((Number) query("SELECT close FROM stock_metrics WHERE trade_date = ?", today)).doubleValue());

        PriceRow revised = row("X", today, 120.0);
        fetcher.publish(List.of(revised));
        PipelineRunReport second = pipeline.run(today);

        assertFalse(second.hasFailures(), second.toString());
        assertEquals(1L, ((Number) query("SELECT COUNT(*) FROM stock_metrics WHERE trade_date = ?", today)).longValue());
        assertEquals(120.0, ((Number) query("SELECT close FROM stock_metrics WHERE trade_date = ?", today)).doubleValue());
        assertEquals(10, injector.getInstance(MetricsTable.class).countRows());
    }

    @Test
    void lateRevisionOfTheYearEndReachesTheNextYearsFirstReturn() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2023, 12, 27), 5);
        fetcher.publish(TestData.series("X", days));
        pipeline.run(days.get(4));

        LocalDate yearEnd = LocalDate.of(2023, 12, 29);
        fetcher.publish(List.of(row("X", yearEnd, 200.0)));
        PipelineRunReport report = pipeline.run(yearEnd);

        assertFalse(report.hasFailures(), report.toString());
        assertEquals(2, report.stage("transform").succeeded());
        EnrichedRow firstOf2024 = injector.getInstance(PartitionStore.class)
                .readEnriched(PartitionKey.enriched(2024, "X")).orElseThrow().rows().get(0);
        assertEquals(100.0 * (103.0 - 200.0) / 200.0, firstOf2024.dailyReturn(), 1e-9);
        assertEquals(200.0, ((Number) query("SELECT close FROM stock_metrics WHERE trade_date = ?", yearEnd)).doubleValue());
    }

    @Test
    void rerunWithoutNewDataChangesNothing() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2023, 3, 1), 5);
        fetcher.publish(TestData.series("X", days));
        pipeline.run(days.get(4));
        long rows = injector.getInstance(MetricsTable.class).countRows();

        PipelineRunReport again = pipeline.run(days.get(4));
        assertFalse(again.isFailure(), again.toString());
        assertEquals(rows, injector.getInstance(MetricsTable.class).countRows());
    }

    @Test
    void backfillThenTransformAndLoadAllPartitions() throws Exception {
        List<LocalDate> days = TestData.tradingDays(LocalDate.of(2022, 11, 1), 60);
        fetcher.publish(TestData.series("X", days));
        LocalDate today = days.get(59);

        PipelineRunReport report = new PipelineRunReport();
        pipeline.backfill(today, report);
        report.add(pipeline.transformAll());
        report.add(pipeline.load(today));

        assertFalse(report.hasFailures(), report.toString());
        assertEquals(2, report.stage("transform").succeeded());
        assertEquals(60, injector.getInstance(MetricsTable.class).countRows());
    }
}
