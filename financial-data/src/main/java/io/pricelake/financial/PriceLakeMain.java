package io.pricelake.financial;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.pricelake.config.PipelineConfig;
import io.pricelake.error.DeadLetterSink;
import io.pricelake.financial.load.InstrumentCatalogLoader;
import io.pricelake.financial.registry.InstrumentRegistry;
import io.pricelake.runtime.KeyedExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point. Exit codes: 0 when no stage failed, 1 when a stage failed (or, with
 * {@code --fail-on-partial}, when any key failed), 2 on usage errors.
 */
@CommandLine.Command(name = "pricelake", mixinStandardHelpOptions = true,
        description = "Ingest, enrich and load daily prices",
        subcommands = {
                PriceLakeMain.Run.class,
                PriceLakeMain.Ingest.class,
                PriceLakeMain.Backfill.class,
                PriceLakeMain.Transform.class,
                PriceLakeMain.Load.class,
                PriceLakeMain.Catalog.class
        })
public final class PriceLakeMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PriceLakeMain.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new PriceLakeMain());
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return CommandLine.ExitCode.USAGE;
    }

    static final class Options {
        @CommandLine.Option(names = {"-t", "--ticker"}, split = ",", description = "Instrument ids (comma-separated or repeated)")
        List<String> tickers = new ArrayList<>();

        @CommandLine.Option(names = "--registry-file", description = "Constituents CSV to read instruments from")
        Path registryFile;

        @CommandLine.Option(names = "--store", description = "Object store root directory")
        Path storeRoot;

        @CommandLine.Option(names = "--jdbc-url", description = "JDBC url of the relational store")
        String jdbcUrl;

        @CommandLine.Option(names = {"-w", "--workers"}, description = "Concurrent per-key operations")
        Integer workers;

        @CommandLine.Option(names = {"-d", "--date"}, description = "Run date (yyyy-MM-dd); default today (UTC)")
        LocalDate date;

        @CommandLine.Option(names = "--backfill-start", description = "First date of the full history (yyyy-MM-dd)")
        LocalDate backfillStart;

        @CommandLine.Option(names = "--fail-on-partial", description = "Exit 1 when any key failed")
        boolean failOnPartial;

        LocalDate runDate() { return date != null ? date : LocalDate.now(ZoneOffset.UTC); }

        Injector injector() {
            PipelineConfig pc = PipelineConfig.fromEnv();
            if (workers != null) pc = pc.withWorkers(workers);
            MarketDataConfig mc = MarketDataConfig.fromEnv();
            if (storeRoot != null) mc = mc.withStoreRoot(storeRoot);
            if (jdbcUrl != null) mc = mc.withJdbcUrl(jdbcUrl);
            if (!tickers.isEmpty() || registryFile != null) mc = mc.withTickers(tickers.isEmpty() ? mc.tickers() : tickers, registryFile);
            if (backfillStart != null) mc = mc.withBackfillStart(backfillStart);
            return Guice.createInjector(new MarketDataModule(pc, mc));
        }

        int exitCode(PipelineRunReport report) {
            report.summary().forEach(log::info);
            if (report.isFailure()) return 1;
            if (failOnPartial && report.hasFailures()) return 1;
            return 0;
        }
    }

    abstract static class PipelineCommand implements Callable<Integer> {
        @CommandLine.Mixin
        Options options = new Options();

        @Override
        public Integer call() throws Exception {
            Injector injector = options.injector();
            KeyedExecutor executor = injector.getInstance(KeyedExecutor.class);
            try {
                PipelineRunReport report = new PipelineRunReport();
                execute(injector.getInstance(MarketDataPipeline.class), options.runDate(), report);
                return options.exitCode(report);
            } finally {
                executor.close();
                injector.getInstance(DeadLetterSink.class).close();
                report(injector.getInstance(MetricRegistry.class));
            }
        }

        abstract void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) throws Exception;
    }

    @CommandLine.Command(name = "run", description = "Incremental ingest, transform and load")
    static final class Run extends PipelineCommand {
        @Override
        void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) {
            for (var stage : pipeline.run(runDate).stages()) report.add(stage);
        }
    }

    @CommandLine.Command(name = "ingest", description = "Fetch missing ranges and merge them into raw partitions")
    static final class Ingest extends PipelineCommand {
        @Override
        void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) {
            pipeline.ingest(runDate, report);
        }
    }

    @CommandLine.Command(name = "backfill", description = "Fetch and merge the full history")
    static final class Backfill extends PipelineCommand {
        @Override
        void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) {
            pipeline.backfill(runDate, report);
        }
    }

    @CommandLine.Command(name = "transform", description = "Enrich every raw partition")
    static final class Transform extends PipelineCommand {
        @Override
        void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) {
            report.add(pipeline.transformAll());
        }
    }

    @CommandLine.Command(name = "load", description = "Load new enriched rows into the relational store")
    static final class Load extends PipelineCommand {
        @Override
        void execute(MarketDataPipeline pipeline, LocalDate runDate, PipelineRunReport report) {
            report.add(pipeline.load(runDate));
        }
    }

    @CommandLine.Command(name = "catalog", description = "Replace the instrument table with the registry contents")
    static final class Catalog implements Callable<Integer> {
        @CommandLine.Mixin
        Options options = new Options();

        @Override
        public Integer call() throws Exception {
            Injector injector = options.injector();
            int n = injector.getInstance(InstrumentCatalogLoader.class).load(injector.getInstance(InstrumentRegistry.class));
            log.info("Catalog load wrote {} instruments", n);
            return 0;
        }
    }

    private static void report(MetricRegistry registry) {
        Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger("io.pricelake.metrics"))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build()
                .report();
    }
}
