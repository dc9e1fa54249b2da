package io.trading.optionchain.feed;

/**
 * Exponential backoff for shard reconnects.
 * The delay starts at the initial delay and doubles after every failed attempt,
 * capped at the max delay. After {@code maxAttempts} failures no further retry is allowed
 * until {@link #reset()} is called on a successful connect.
 */
public final class ReconnectPolicy {

    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;

    private long currentDelayMs;
    private int attemptCount;

    public ReconnectPolicy(long initialDelayMs, long maxDelayMs, int maxAttempts) {
        if (initialDelayMs <= 0) {
            throw new IllegalArgumentException("initialDelayMs must be positive: " + initialDelayMs);
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts cannot be negative: " + maxAttempts);
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
        this.currentDelayMs = initialDelayMs;
    }

    /**
     * Creates a policy starting at one second.
     *
     * @param maxDelaySeconds Cap on the delay between attempts
     * @param maxAttempts     Attempts allowed before the shard is exhausted
     */
    public static ReconnectPolicy ofSeconds(int maxDelaySeconds, int maxAttempts) {
        return new ReconnectPolicy(DEFAULT_INITIAL_DELAY_MS, maxDelaySeconds * 1000L, maxAttempts);
    }

    /**
     * Returns a new policy with the same settings and no recorded attempts.
     */
    public ReconnectPolicy fresh() {
        return new ReconnectPolicy(initialDelayMs, maxDelayMs, maxAttempts);
    }

    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized long nextDelayMs() {
        return currentDelayMs;
    }

    /**
     * Records a failed attempt and grows the delay.
     *
     * @return The attempt number just recorded, starting at 1
     */
    public synchronized int recordFailure() {
        attemptCount++;
        currentDelayMs = Math.min(currentDelayMs * 2, maxDelayMs);
        return attemptCount;
    }

    public synchronized void reset() {
        attemptCount = 0;
        currentDelayMs = initialDelayMs;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
