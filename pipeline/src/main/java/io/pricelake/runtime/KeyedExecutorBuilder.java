package io.pricelake.runtime;

import com.codahale.metrics.MetricRegistry;
import io.pricelake.error.DeadLetterSink;
import io.pricelake.metrics.Metrics;
import io.pricelake.retry.ExponentialBackoffRetryPolicy;
import io.pricelake.retry.RetryPolicy;

import java.time.Duration;

public class KeyedExecutorBuilder {
    private int workers = 10;
    private Duration operationTimeout = Duration.ofSeconds(60);
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(3, 100, 2_000);
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink deadLetters = DeadLetterSink.none();

    public KeyedExecutorBuilder workers(int w) { this.workers = Math.max(1, w); return this; }
    public KeyedExecutorBuilder operationTimeout(Duration d) { this.operationTimeout = d; return this; }
    public KeyedExecutorBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public KeyedExecutorBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public KeyedExecutorBuilder deadLetters(DeadLetterSink d) { this.deadLetters = d; return this; }

    public KeyedExecutor build() {
        return new KeyedExecutor(workers, operationTimeout, retryPolicy, new Metrics(metricRegistry), deadLetters);
    }
}
