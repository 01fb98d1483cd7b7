package com.rtbhouse.kafka.dispatch.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ShutdownListenerThread extends Thread {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownListenerThread.class);

    private final DispatchConsumerImpl<?, ?> consumer;

    private boolean shutdown = false;

    public ShutdownListenerThread(DispatchConsumerImpl<?, ?> consumer) {
        super("shutdown-thread");
        this.consumer = consumer;
    }

    @Override
    public void run() {
        try {
            waitForShutdown();
        } catch (InterruptedException e) {
            logger.error("interrupted while waiting for shutdown", e);
        }
        consumer.close();
    }

    public synchronized void shutdown() {
        shutdown = true;
        notifyAll();
    }

    private synchronized void waitForShutdown() throws InterruptedException {
        while (!shutdown) {
            logger.info("waiting for being notified to shutdown");
            wait();
        }
    }

}
