package com.example.chatsync.client;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential reconnect delay: {@code min(max, initial * 2^attempt)} plus up to
 * {@code jitterRatio} of that value.
 */
public class BackoffPolicy {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;
    private final DoubleSupplier random;

    public BackoffPolicy(long initialDelayMs, long maxDelayMs, double jitterRatio) {
        this(initialDelayMs, maxDelayMs, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(long initialDelayMs, long maxDelayMs, double jitterRatio, DoubleSupplier random) {
        if (initialDelayMs <= 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException("Need 0 < initialDelayMs <= maxDelayMs");
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public static BackoffPolicy from(SyncClientProperties props) {
        return new BackoffPolicy(props.getInitialDelayMs(), props.getMaxDelayMs(), props.getJitterRatio());
    }

    public long baseDelayMs(int attempt) {
        if (attempt >= 62) return maxDelayMs;
        long multiplier = 1L << attempt;
        if (initialDelayMs > maxDelayMs / multiplier) return maxDelayMs;
        return Math.min(maxDelayMs, initialDelayMs * multiplier);
    }

    public long delayMs(int attempt) {
        long base = baseDelayMs(attempt);
        return base + (long) (base * jitterRatio * random.getAsDouble());
    }
}
