package com.rtbhouse.kafka.dispatch.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchException;

public abstract class AbstractDispatchThread extends Thread {

    private static final Logger logger = LoggerFactory.getLogger(AbstractDispatchThread.class);

    private final String name;
    protected final DispatchConfig config;
    protected final DispatchConsumerImpl<?, ?> consumer;

    protected volatile boolean shutdown = false;
    private volatile DispatchException exception;

    protected volatile boolean stopped = false;

    public AbstractDispatchThread(String name, DispatchConfig config, DispatchConsumerImpl<?, ?> consumer) {
        super(name);
        this.name = name;
        this.config = config;
        this.consumer = consumer;
    }

    public abstract void init();

    public abstract void process() throws InterruptedException;

    public abstract void close();

    // used to shutdown current thread internally because of failure
    public void shutdown(DispatchException exception) {
        if (exception != null) {
            this.exception = exception;
        }
        this.shutdown = true;
    }

    // used to shutdown current thread by its owner
    public final void shutdown() {
        shutdown(null);
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public final void run() {
        logger.info("thread {} started", name);
        boolean closing = false;
        try {
            init();
            while (!shutdown) {
                process();
            }
            closing = true;
            close();
            if (exception != null) {
                throw exception;
            }
        } catch (Throwable e) {
            logger.error("Thread shuts down DispatchConsumer", e);
            consumer.shutdown(wrapIfNeeded(e));
            if (!closing) {
                closeAfterFailure();
            }
        } finally {
            stopped = true;
        }
        logger.info("thread {} stopped", name);
    }

    private void closeAfterFailure() {
        try {
            close();
        } catch (RuntimeException e) {
            logger.error("thread {} could not be closed after failure", name, e);
        }
    }

    private DispatchException wrapIfNeeded(Throwable e) {
        return (e instanceof DispatchException) ? (DispatchException) e : new DispatchException(e);
    }

}
