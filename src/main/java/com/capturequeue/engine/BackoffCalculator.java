package com.capturequeue.engine;

import com.capturequeue.config.PipelineConfig;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code min(baseDelay * 2^attempt, maxDelay)}, plus an
 * optional random jitter of up to {@code jitterRatio} of that delay.
 *
 * <p>Attempt 0 is the delay before the first retry. With the defaults
 * (1000 ms base, 8000 ms cap) the waits are 1s, 2s, 4s, 8s, 8s...</p>
 *
 * <p><b>Thread Safety:</b> Immutable; jitter uses {@link ThreadLocalRandom}.</p>
 *
 * @author Capture Queue Team
 */
public class BackoffCalculator {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;

    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterRatio) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid backoff bounds: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be between 0 and 1: " + jitterRatio);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
    }

    public static BackoffCalculator fromConfig(PipelineConfig config) {
        return new BackoffCalculator(config.getBaseDelayMs(), config.getMaxDelayMs(), config.getJitterRatio());
    }

    /**
     * Deterministic part of the delay.
     *
     * @param attempt zero-based retry attempt
     * @return delay in milliseconds, never above the configured maximum
     * @throws IllegalArgumentException if attempt is negative
     */
    public long baseDelayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        }
        if (attempt >= 62) {
            return maxDelayMs;
        }
        try {
            return Math.min(Math.multiplyExact(baseDelayMs, 1L << attempt), maxDelayMs);
        } catch (ArithmeticException overflow) {
            return maxDelayMs;
        }
    }

    /**
     * Delay to wait before retry {@code attempt + 1}, jitter included.
     *
     * @param attempt zero-based retry attempt
     * @return delay in milliseconds
     */
    public long delayFor(int attempt) {
        long delay = baseDelayFor(attempt);
        if (jitterRatio == 0.0 || delay == 0) {
            return delay;
        }
        long jitter = (long) (delay * jitterRatio * ThreadLocalRandom.current().nextDouble());
        return delay + jitter;
    }

    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public double getJitterRatio() { return jitterRatio; }
}
