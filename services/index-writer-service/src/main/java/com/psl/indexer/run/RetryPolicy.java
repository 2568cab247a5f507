package com.psl.indexer.run;

import com.psl.indexer.config.IndexerProperties;

/**
 * Single exponential backoff policy shared by the fetch and index stages.
 */
public class RetryPolicy {
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double multiplier;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, double multiplier, long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        this.maxBackoffMs = Math.max(0, maxBackoffMs);
    }

    public static RetryPolicy from(IndexerProperties properties) {
        return new RetryPolicy(
            properties.getMaxAttempts(),
            properties.getInitialBackoffMs(),
            properties.getBackoffMultiplier(),
            properties.getMaxBackoffMs()
        );
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before attempt {@code attempt + 1}, given that {@code attempt} (1-based) just failed.
     */
    public long backoffMs(int attempt) {
        double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, (double) maxBackoffMs);
    }
}
