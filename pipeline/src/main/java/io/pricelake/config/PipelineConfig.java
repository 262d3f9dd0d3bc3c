package io.pricelake.config;

import java.time.Duration;

/**
 * Runtime knobs shared by every stage. Each value comes from a system property, then an environment variable,
 * then a default.
 */
public record PipelineConfig(
        int workers,
        Duration operationTimeout,
        int retryAttempts,
        long retryBaseMillis,
        long retryMaxMillis
) {
    public static PipelineConfig fromEnv() {
        int workers = Integer.parseInt(setting("pricelake.workers", "PRICELAKE_WORKERS", "10"));
        long timeoutMs = Long.parseLong(setting("pricelake.timeout.ms", "PRICELAKE_TIMEOUT_MS", "60000"));
        int attempts = Integer.parseInt(setting("pricelake.retry.attempts", "PRICELAKE_RETRY_ATTEMPTS", "3"));
        long base = Long.parseLong(setting("pricelake.retry.base.ms", "PRICELAKE_RETRY_BASE_MS", "200"));
        long max = Long.parseLong(setting("pricelake.retry.max.ms", "PRICELAKE_RETRY_MAX_MS", "5000"));
        return new PipelineConfig(workers, Duration.ofMillis(timeoutMs), attempts, base, max);
    }

    public PipelineConfig withWorkers(int w) {
        return new PipelineConfig(w, operationTimeout, retryAttempts, retryBaseMillis, retryMaxMillis);
    }

    public static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }
}
