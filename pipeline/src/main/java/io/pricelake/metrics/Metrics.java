package io.pricelake.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin naming layer over a shared {@link MetricRegistry}.
 */
public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }
    public Histogram histogram(String name) { return registry.histogram(name); }

    public Counter stageCounter(String stage, String outcome) { return registry.counter("stage." + stage + "." + outcome); }
    public Timer stageTimer(String stage) { return registry.timer("stage." + stage + ".time"); }
}
