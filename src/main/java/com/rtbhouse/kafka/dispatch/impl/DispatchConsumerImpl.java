package com.rtbhouse.kafka.dispatch.impl;

import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CANNOT_STOP_THREADS;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CLOSED_GRACEFULLY;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CLOSED_NOT_GRACEFULLY;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CLOSING;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CLOSING_INTERRUPTED;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.CREATED;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.SHUTDOWN;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.STARTED;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.STARTING;
import static com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status.isTransitionAllowed;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import javax.annotation.Nullable;

import org.apache.kafka.clients.consumer.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status;
import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.ShutdownCallback;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.impl.assign.RoundRobinPartitionAssigner;
import com.rtbhouse.kafka.dispatch.impl.consumer.ConsumerThread;
import com.rtbhouse.kafka.dispatch.impl.consumer.KafkaOffsetStorage;
import com.rtbhouse.kafka.dispatch.impl.errors.BadStatusException;
import com.rtbhouse.kafka.dispatch.impl.stream.MessageStream;
import com.rtbhouse.kafka.dispatch.impl.stream.StreamsManager;

public class DispatchConsumerImpl<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(DispatchConsumerImpl.class);

    private final DispatchConfig config;
    private final ProcessingStrategy<K, V> strategy;
    private final OffsetStorage offsetStorage;
    private final ShutdownCallback callback;
    private final Supplier<Consumer<K, V>> kafkaConsumerSupplier;

    private volatile StreamsManager<K, V> streamsManager;
    private ConsumerThread<K, V> consumerThread;

    private final ShutdownListenerThread shutdownThread;
    private final Object shutdownLock = new Object();

    private volatile Status status = CREATED;
    private final Object statusLock = new Object();

    private volatile DispatchException exception;

    public DispatchConsumerImpl(
            DispatchConfig config,
            ProcessingStrategy<K, V> strategy,
            @Nullable OffsetStorage offsetStorage,
            @Nullable ShutdownCallback callback,
            Supplier<Consumer<K, V>> kafkaConsumerSupplier) {
        this.config = config;
        this.strategy = strategy;
        this.offsetStorage = offsetStorage;
        this.callback = callback;
        this.kafkaConsumerSupplier = kafkaConsumerSupplier;
        this.shutdownThread = new ShutdownListenerThread(this);
    }

    public void start() {
        setStatus(STARTING);
        logger.info("dispatch consumer starting");

        Consumer<K, V> kafkaConsumer = kafkaConsumerSupplier.get();
        OffsetStorage storage = offsetStorage != null
                ? offsetStorage
                : new KafkaOffsetStorage(kafkaConsumer, config.getCommitRetries());
        streamsManager = new StreamsManager<>(config, this, strategy, storage, new RoundRobinPartitionAssigner());
        consumerThread = new ConsumerThread<>(config, this, streamsManager, kafkaConsumer, storage);
        consumerThread.setDaemon(false);

        consumerThread.start();
        if (tryToSetStatus(STARTED)) {
            logger.info("dispatch consumer started");
        } else {
            logger.warn("dispatch consumer shut down while starting, status: {}", status);
        }
        shutdownThread.start();
    }

    public void blockingShutdown() {
        logger.info("dispatch consumer blocking shutdown called");
        shutdown(null);
        waitForShutdown();
    }

    public void shutdown(@Nullable DispatchException exception) {
        logger.info("dispatch consumer shutdown called");
        synchronized (statusLock) {
            if (exception != null && this.exception == null) {
                // the first failure wins, also when it happens after a shutdown has been requested
                this.exception = exception;
            }
            if (!tryToSetStatus(SHUTDOWN)) {
                return;
            }
        }
        shutdownThread.shutdown();
    }

    public void close() {
        setStatus(CLOSING);
        logger.info("dispatch consumer closing");

        consumerThread.shutdown();

        Duration shutdownTimeout = config.getConsumerShutdownTimeout();
        Status terminalStatus;
        try {
            logger.info("consumerThread.join({}s)", shutdownTimeout.toSeconds());
            consumerThread.join(shutdownTimeout.toMillis());
            if (!consumerThread.isAlive()) {
                terminalStatus = CLOSED_GRACEFULLY;
                logger.info("consumer thread stopped");
            } else {
                logger.warn("Thread [{}] has not finished in {}s (calling interrupt).", consumerThread.getName(),
                        shutdownTimeout.toSeconds());
                consumerThread.interrupt();
                consumerThread.join(shutdownTimeout.toMillis());
                if (!consumerThread.isAlive()) {
                    terminalStatus = CLOSED_NOT_GRACEFULLY;
                    logger.info("consumer thread stopped after interruption");
                } else {
                    terminalStatus = CANNOT_STOP_THREADS;
                    logger.error("Couldn't stop [{}]", consumerThread.getName());
                }
            }
        } catch (InterruptedException e) {
            terminalStatus = CLOSING_INTERRUPTED;
            logger.error("interrupted", e);
        }

        if (callback != null) {
            callback.onShutdown(exception);
        }

        setStatus(terminalStatus);
        logger.info("dispatch consumer closed with status: {}", status);

        synchronized (shutdownLock) {
            shutdownLock.notifyAll();
        }
    }

    private void setStatus(Status newStatus) {
        if (!tryToSetStatus(newStatus)) {
            throw new BadStatusException("could not set: " + newStatus);
        }
    }

    private boolean tryToSetStatus(Status newStatus) {
        synchronized (statusLock) {
            Status oldStatus = status;
            if (isTransitionAllowed(oldStatus, newStatus)) {
                status = newStatus;
                logger.info("status changed, old: {}, new: {}", oldStatus, newStatus);
                return true;
            }
        }
        return false;
    }

    public Status getStatus() {
        return status;
    }

    @Nullable
    public DispatchException getException() {
        return exception;
    }

    public List<MessageStream> getStreams(String topic) {
        StreamsManager<K, V> manager = streamsManager;
        return manager != null ? manager.streams(topic) : List.of();
    }

    public Status waitForShutdown() {
        Instant closingStartedAt = null;
        // join + join after interruption
        Duration shutdownTotalLimit = config.getConsumerShutdownTimeout().multipliedBy(2).plusSeconds(5);
        synchronized (shutdownLock) {
            while (!status.isTerminal()
                    && !timedOut(closingStartedAt, shutdownTotalLimit)
                    && shutdownThread.isAlive()) {
                if (status.equals(CLOSING) && closingStartedAt == null) {
                    closingStartedAt = Instant.now();
                }
                try {
                    // timeout is needed to check whether a shutdownThread is still alive
                    shutdownLock.wait(1_000L);
                } catch (InterruptedException e) {
                    logger.error("interrupted", e);
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        if (!status.isTerminal()) {
            logger.error("dispatch consumer has not set a terminal status [status={}]", status);
        }

        return status;
    }

    private boolean timedOut(@Nullable Instant startedAt, Duration timeout) {
        if (startedAt == null) {
            return false;
        }

        return !Instant.now().isBefore(startedAt.plus(timeout));
    }
}
