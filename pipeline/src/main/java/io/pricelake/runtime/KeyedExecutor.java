package io.pricelake.runtime;

import com.codahale.metrics.Timer;
import io.pricelake.core.KeyResult;
import io.pricelake.core.KeyedOperation;
import io.pricelake.core.StageReport;
import io.pricelake.error.DeadLetterSink;
import io.pricelake.error.FailureKind;
import io.pricelake.metrics.Metrics;
import io.pricelake.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a stage out over independent keys on a bounded worker pool and joins on all of them before returning.
 * <p>
 * At most {@code workers} operations run at once. Each key gets its own retry loop for transient failures and
 * its own timeout, which starts when the key begins executing and covers its retries. A key past its timeout has
 * its worker interrupted, and the stage returns only after every worker has let go of its key, so no operation of
 * a returned stage is still running. A failing or timed-out key is recorded and dead-lettered; it never cancels
 * its siblings. The returned report holds one result per key, in input order.
 */
public class KeyedExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KeyedExecutor.class);

    private final int workers;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService watchdog;
    private final Semaphore permits;
    private final RetryPolicy retryPolicy;
    private final Duration operationTimeout;
    private final Metrics metrics;
    private final DeadLetterSink deadLetters;

    public KeyedExecutor(int workers, Duration operationTimeout, RetryPolicy retryPolicy, Metrics metrics, DeadLetterSink deadLetters) {
        this.workers = Math.max(1, workers);
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.deadLetters = deadLetters == null ? DeadLetterSink.none() : deadLetters;
        this.permits = new Semaphore(this.workers);
        this.workerPool = Executors.newFixedThreadPool(this.workers, new WorkerThreadFactory("pricelake-worker-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new WorkerThreadFactory("pricelake-timeout-"));
    }

    public int workers() { return workers; }
    public Metrics metrics() { return metrics; }

    public <K, R> StageReport<K, R> runAll(String stage, Collection<K> keys, KeyedOperation<K, R> operation) {
        if (keys.isEmpty()) {
            log.info("{}: nothing to do", stage);
            return StageReport.empty(stage);
        }
        Map<K, KeyResult<R>> collected = new ConcurrentHashMap<>();
        List<CompletableFuture<Void>> pending = new ArrayList<>(keys.size());
        for (K key : keys) {
            try {
                permits.acquire();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                collected.put(key, account(stage, key, KeyResult.failed(FailureKind.TRANSIENT, "interrupted before dispatch")));
                continue;
            }
            CompletableFuture<KeyResult<R>> task;
            try {
                task = CompletableFuture.supplyAsync(() -> {
                    try {
                        return executeWithDeadline(stage, key, operation);
                    } finally {
                        permits.release();
                    }
                }, workerPool);
            } catch (RejectedExecutionException e) {
                permits.release();
                collected.put(key, account(stage, key, KeyResult.failed(FailureKind.INTERNAL, "executor is shut down")));
                continue;
            }
            pending.add(task.handle((result, error) -> {
                KeyResult<R> r = error == null ? result : fromThrowable(error);
                collected.put(key, account(stage, key, r));
                return null;
            }));
        }
        // barrier: every worker has returned, timed-out ones included, before the stage returns
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        Map<K, KeyResult<R>> ordered = new LinkedHashMap<>();
        for (K key : keys) ordered.put(key, collected.get(key));
        StageReport<K, R> report = new StageReport<>(stage, ordered);
        if (report.isFailure()) log.error(report.summary());
        else if (report.hasFailures()) log.warn(report.summary());
        else log.info(report.summary());
        return report;
    }

    /**
     * Runs one key on the calling worker thread. When the timeout elapses the worker is interrupted; whatever the
     * operation was doing is abandoned and no further attempt starts.
     */
    private <K, R> KeyResult<R> executeWithDeadline(String stage, K key, KeyedOperation<K, R> operation) {
        Deadline deadline = new Deadline(Thread.currentThread());
        ScheduledFuture<?> alarm = watchdog.schedule(deadline::expire, operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            KeyResult<R> result = execute(stage, key, operation, deadline);
            if (deadline.expired() && !result.isSucceeded()) return timedOut(stage);
            if (deadline.expired()) log.warn("{} {}: finished after its {}ms timeout", stage, key, operationTimeout.toMillis());
            return result;
        } finally {
            alarm.cancel(false);
            deadline.finish();
        }
    }

    private <K, R> KeyResult<R> execute(String stage, K key, KeyedOperation<K, R> operation, Deadline deadline) {
        Timer timer = metrics.stageTimer(stage);
        int attempt = 0;
        while (true) {
            attempt++;
            try (Timer.Context ignored = timer.time()) {
                KeyResult<R> result = operation.apply(key);
                return result == null ? KeyResult.skipped("no result") : result;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return KeyResult.failed(FailureKind.TRANSIENT, "interrupted");
            } catch (Exception e) {
                if (!deadline.expired() && retryPolicy.shouldRetry(attempt, e)) {
                    metrics.stageCounter(stage, "retries").inc();
                    long backoff = retryPolicy.backoffMillis(attempt);
                    log.warn("{} {}: attempt {} failed, retrying in {}ms: {}", stage, key, attempt, backoff, e.toString());
                    if (!sleepQuiet(backoff)) return KeyResult.failed(FailureKind.TRANSIENT, "interrupted during backoff");
                    continue;
                }
                return KeyResult.failed(FailureKind.classify(e), describe(e));
            }
        }
    }

    private static <R> KeyResult<R> fromThrowable(Throwable error) {
        Throwable cause = FailureKind.unwrap(error);
        return KeyResult.failed(FailureKind.classify(cause), describe(cause));
    }

    private <R> KeyResult<R> timedOut(String stage) {
        metrics.stageCounter(stage, "timeouts").inc();
        return KeyResult.failed(FailureKind.TRANSIENT, "timed out after " + operationTimeout.toMillis() + "ms");
    }

    private <K, R> KeyResult<R> account(String stage, K key, KeyResult<R> result) {
        switch (result.status()) {
            case SUCCEEDED -> metrics.stageCounter(stage, "succeeded").inc();
            case SKIPPED -> {
                metrics.stageCounter(stage, "skipped").inc();
                log.debug("{} {}: skipped ({})", stage, key, result.message());
            }
            case FAILED -> {
                metrics.stageCounter(stage, "failed").inc();
                log.error("{} {}: {} failure: {}", stage, key, result.kind(), result.message());
                deadLetters.acceptFailure(stage, String.valueOf(key), result.kind(), result.message());
            }
        }
        return result;
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private static boolean sleepQuiet(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) workerPool.shutdownNow();
        } catch (InterruptedException ie) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Interrupts its worker once, unless the worker finished first. The interrupt is only ever delivered while the
     * worker is still inside the key, so a pooled thread never carries it into the next key.
     */
    private static final class Deadline {
        private final Thread worker;
        private boolean expired;
        private boolean finished;

        Deadline(Thread worker) { this.worker = worker; }

        synchronized void expire() {
            if (finished) return;
            expired = true;
            worker.interrupt();
        }

        synchronized boolean expired() { return expired; }

        void finish() {
            synchronized (this) {
                finished = true;
            }
            Thread.interrupted();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger n = new AtomicInteger();

        WorkerThreadFactory(String prefix) { this.prefix = prefix; }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
