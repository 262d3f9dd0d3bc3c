package io.pricelake.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.pricelake.budget.RequestBudget;
import io.pricelake.budget.TokenBucketBudget;
import io.pricelake.config.PipelineConfig;
import io.pricelake.error.DeadLetterSink;
import io.pricelake.error.FileDeadLetterSink;
import io.pricelake.financial.enrich.MetricsCalculator;
import io.pricelake.financial.enrich.MetricsTransformer;
import io.pricelake.financial.fetch.HttpYahooClient;
import io.pricelake.financial.fetch.PriceFetcher;
import io.pricelake.financial.fetch.YahooClient;
import io.pricelake.financial.fetch.YahooPriceFetcher;
import io.pricelake.financial.ingest.IngestionMergeEngine;
import io.pricelake.financial.ingest.IngestionPlanner;
import io.pricelake.financial.load.ConnectionFactory;
import io.pricelake.financial.load.DriverManagerConnectionFactory;
import io.pricelake.financial.load.IncrementalLoader;
import io.pricelake.financial.load.InstrumentCatalogLoader;
import io.pricelake.financial.load.JdbcMetricsTable;
import io.pricelake.financial.load.MetricsTable;
import io.pricelake.financial.quality.QualityGate;
import io.pricelake.financial.registry.CsvInstrumentRegistry;
import io.pricelake.financial.registry.InstrumentRegistry;
import io.pricelake.financial.registry.StaticInstrumentRegistry;
import io.pricelake.financial.store.FileObjectStore;
import io.pricelake.financial.store.ObjectStore;
import io.pricelake.financial.store.PartitionStore;
import io.pricelake.metrics.Metrics;
import io.pricelake.retry.ExponentialBackoffRetryPolicy;
import io.pricelake.runtime.KeyedExecutor;
import io.pricelake.runtime.KeyedExecutorBuilder;

import java.io.IOException;

public class MarketDataModule extends AbstractModule {
    private final PipelineConfig pipelineConfig;
    private final MarketDataConfig config;

    public MarketDataModule(PipelineConfig pipelineConfig, MarketDataConfig config) {
        this.pipelineConfig = pipelineConfig;
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(PipelineConfig.class).toInstance(pipelineConfig);
        bind(MarketDataConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton DeadLetterSink deadLetters() throws IOException { return new FileDeadLetterSink(config.deadLetterFile()); }

    @Provides @Singleton KeyedExecutor executor(MetricRegistry registry, DeadLetterSink deadLetters) {
        return new KeyedExecutorBuilder()
                .workers(pipelineConfig.workers())
                .operationTimeout(pipelineConfig.operationTimeout())
                .retry(new ExponentialBackoffRetryPolicy(pipelineConfig.retryAttempts(), pipelineConfig.retryBaseMillis(), pipelineConfig.retryMaxMillis()))
                .metrics(registry)
                .deadLetters(deadLetters)
                .build();
    }

    @Provides @Singleton ObjectStore objectStore() throws IOException { return new FileObjectStore(config.storeRoot()); }

    @Provides @Singleton PartitionStore partitionStore(ObjectStore objects) { return new PartitionStore(objects); }

    @Provides @Singleton RequestBudget requestBudget() { return new TokenBucketBudget(config.externalQps()); }

    @Provides @Singleton YahooClient yahooClient() { return new HttpYahooClient(config.fetchTimeout()); }

    @Provides @Singleton PriceFetcher priceFetcher(YahooClient client, RequestBudget budget, Metrics metrics) {
        return new YahooPriceFetcher(client, budget, metrics);
    }

    @Provides @Singleton InstrumentRegistry instrumentRegistry() {
        return config.registryFile() != null ? new CsvInstrumentRegistry(config.registryFile()) : new StaticInstrumentRegistry(config.tickers());
    }

    @Provides @Singleton ConnectionFactory connectionFactory() {
        return new DriverManagerConnectionFactory(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
    }

    @Provides @Singleton MetricsTable metricsTable(ConnectionFactory connections) {
        return new JdbcMetricsTable(connections, config.metricsTable());
    }

    @Provides InstrumentCatalogLoader catalogLoader(ConnectionFactory connections) {
        return new InstrumentCatalogLoader(connections, config.instrumentsTable());
    }

    @Provides QualityGate qualityGate(Metrics metrics) { return new QualityGate(metrics); }

    @Provides MetricsCalculator metricsCalculator() { return new MetricsCalculator(config.rollingWindow()); }

    @Provides IngestionPlanner planner(PartitionStore store, KeyedExecutor executor) {
        return new IngestionPlanner(store, executor, config.backfillStart(), config.provisionalDays());
    }

    @Provides IngestionMergeEngine mergeEngine(PartitionStore store, KeyedExecutor executor) {
        return new IngestionMergeEngine(store, executor);
    }

    @Provides MetricsTransformer transformer(PartitionStore store, QualityGate gate, MetricsCalculator calculator, KeyedExecutor executor) {
        return new MetricsTransformer(store, gate, calculator, executor);
    }

    @Provides IncrementalLoader loader(PartitionStore store, MetricsTable table, KeyedExecutor executor) {
        return new IncrementalLoader(store, table, executor);
    }

    @Provides @Singleton MarketDataPipeline pipeline(InstrumentRegistry registry, IngestionPlanner planner, PriceFetcher fetcher,
                                                     IngestionMergeEngine mergeEngine, MetricsTransformer transformer,
                                                     IncrementalLoader loader, KeyedExecutor executor) {
        return new MarketDataPipeline(registry, planner, fetcher, mergeEngine, transformer, loader, executor);
    }
}
