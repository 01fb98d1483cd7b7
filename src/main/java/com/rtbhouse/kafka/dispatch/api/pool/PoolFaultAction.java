package com.rtbhouse.kafka.dispatch.api.pool;

/**
 * Action taken when a worker pool observes too many failed or timed out tasks within the configured window.
 */
public enum PoolFaultAction {

    /**
     * Shuts the whole consumer down with the fault as the cause.
     */
    SHUTDOWN_CONSUMER,

    /**
     * Stops the faulted partition's pool (committing what was processed) and keeps the partition paused until the
     * next rebalance.
     */
    STOP_PARTITION;

    public static PoolFaultAction fromString(String string) {
        if (string != null) {
            return PoolFaultAction.valueOf(string.toUpperCase());
        }
        throw new IllegalArgumentException();
    }
}
