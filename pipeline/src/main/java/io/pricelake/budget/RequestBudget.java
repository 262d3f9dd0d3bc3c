package io.pricelake.budget;

/**
 * Budget for calls against an external API.
 */
public interface RequestBudget {
    /** Block as needed to respect the request rate (one call). */
    void acquire() throws InterruptedException;

    static RequestBudget unlimited() {
        return () -> { };
    }
}
