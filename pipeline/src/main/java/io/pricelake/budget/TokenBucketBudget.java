package io.pricelake.budget;

import java.util.concurrent.TimeUnit;

/**
 * Naive token bucket: {@code permitsPerSecond} tokens refill continuously, with an initial burst of one second.
 */
public class TokenBucketBudget implements RequestBudget {
    private final long permitsPerSecond;
    private long tokens;
    private long lastRefillNanos;

    public TokenBucketBudget(long permitsPerSecond) {
        this.permitsPerSecond = Math.max(0, permitsPerSecond);
        this.tokens = this.permitsPerSecond;
        this.lastRefillNanos = System.nanoTime();
    }

    @Override
    public synchronized void acquire() throws InterruptedException {
        if (permitsPerSecond <= 0) return; // no limit
        while (true) {
            refill();
            if (tokens > 0) {
                tokens--;
                return;
            }
            Thread.sleep(1);
        }
    }

    private void refill() {
        long now = System.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;
        long add = (permitsPerSecond * elapsed) / TimeUnit.SECONDS.toNanos(1);
        if (add > 0) {
            tokens = Math.min(permitsPerSecond, tokens + add);
            lastRefillNanos = now;
        }
    }
}
