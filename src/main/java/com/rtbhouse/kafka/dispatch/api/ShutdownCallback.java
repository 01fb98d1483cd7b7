package com.rtbhouse.kafka.dispatch.api;

/**
 * A callback interface which could be used to implement custom actions for {@link DispatchConsumer} instance shutdown.
 */
public interface ShutdownCallback {

    /**
     * Called once the {@link DispatchConsumer} instance is closed, either because of {@link DispatchConsumer#shutdown()}
     * call or because of a failure in any of background threads (uncaught exception, pool fault, failed commit).
     *
     * @param exception
     *            The exception which caused the shutdown, or null if the instance is closed gracefully.
     */
    void onShutdown(DispatchException exception);

}
