package com.rtbhouse.kafka.dispatch.impl.failure;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

import com.google.common.base.Ticker;

/**
 * Sliding time window failure counter. Every {@link #failed()} call records one failure and tells whether at least
 * {@code threshold} failures happened within the trailing {@code window}.
 */
public class FailureCounter {

    private final int threshold;
    private final long windowNanos;
    private final Ticker ticker;

    // never holds more than threshold entries, older ones cannot change the outcome
    private final Deque<Long> failureTimestamps = new ArrayDeque<>();

    public FailureCounter(int threshold, Duration window) {
        this(threshold, window, Ticker.systemTicker());
    }

    public FailureCounter(int threshold, Duration window, Ticker ticker) {
        checkArgument(threshold > 0, "failure threshold should be positive but is: %s", threshold);
        checkArgument(!window.isNegative() && !window.isZero(), "failure window should be positive but is: %s", window);
        this.threshold = threshold;
        this.windowNanos = window.toNanos();
        this.ticker = ticker;
    }

    /**
     * Records a failure.
     *
     * @return true if the threshold is reached within the window ending now
     */
    public synchronized boolean failed() {
        long now = ticker.read();
        failureTimestamps.addLast(now);
        while (now - failureTimestamps.peekFirst() >= windowNanos || failureTimestamps.size() > threshold) {
            failureTimestamps.removeFirst();
        }
        return failureTimestamps.size() >= threshold;
    }

    public synchronized int failuresInWindow() {
        long now = ticker.read();
        return (int) failureTimestamps.stream().filter(timestamp -> now - timestamp < windowNanos).count();
    }

    public int threshold() {
        return threshold;
    }

    public Duration window() {
        return Duration.ofNanos(windowNanos);
    }
}
