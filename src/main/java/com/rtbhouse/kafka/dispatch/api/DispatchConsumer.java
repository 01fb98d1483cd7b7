package com.rtbhouse.kafka.dispatch.api;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.kafka.clients.consumer.KafkaConsumer;

import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.stream.MessageStream;

/**
 * {@code DispatchConsumer} consumes Kafka topics and processes every message with a user-defined
 * {@link ProcessingStrategy}, running many messages of one partition concurrently while committing offsets only once
 * they are resolved.
 * <p>
 * Internally one {@code DispatchConsumer} instance launches one consumer thread which owns the {@link KafkaConsumer}.
 * Partitions of every topic are spread across a configurable number of message streams and each assigned partition
 * gets its own worker pool with a fixed number of workers. A pool whose tasks keep failing is faulted, which either
 * shuts the whole consumer down or stops only the affected partition.
 * <p>
 * Usage example:
 * <pre>
 * {@code
 *     Properties properties = new Properties();
 *     properties.setProperty("consumer.topics", "my-topic");
 *     properties.setProperty("consumer.kafka.bootstrap.servers", "localhost:9192");
 *     properties.setProperty("consumer.kafka.group.id", "my-dispatcher");
 *     properties.setProperty("consumer.kafka.key.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
 *     properties.setProperty("consumer.kafka.value.deserializer", "org.apache.kafka.common.serialization.StringDeserializer");
 *     properties.setProperty("pool.workers.num", "20");
 *
 *     DispatchConsumer<String, String> consumer = new DispatchConsumer<>(
 *             new DispatchConfig(properties),
 *             (worker, message, taskId) -> handle(message) ? TaskResult.successful(taskId) : TaskResult.processingFailed(taskId),
 *             new MyShutdownCallback());
 *
 *     Runtime.getRuntime().addShutdownHook(new Thread(consumer::shutdown));
 *     consumer.start();
 * }
 * </pre>
 */
public class DispatchConsumer<K, V> {

    public enum Status {
        CREATED, STARTING, STARTED, SHUTDOWN, CLOSING, CLOSED_GRACEFULLY, CLOSED_NOT_GRACEFULLY, CANNOT_STOP_THREADS, CLOSING_INTERRUPTED;

        private static final Map<Status, Set<Status>> ALLOWED_TRANSITIONS = Map.of(
                CREATED, Set.of(STARTING),
                STARTING, Set.of(STARTED, SHUTDOWN),
                STARTED, Set.of(SHUTDOWN),
                SHUTDOWN, Set.of(CLOSING),
                CLOSING, Set.of(CLOSED_GRACEFULLY, CLOSED_NOT_GRACEFULLY, CANNOT_STOP_THREADS, CLOSING_INTERRUPTED)
        );

        private static final Set<Status> TERMINAL_STATUSES = EnumSet.complementOf(EnumSet.copyOf(ALLOWED_TRANSITIONS.keySet()));

        public static boolean isTransitionAllowed(Status from, Status to) {
            return Optional.ofNullable(from)
                    .map(ALLOWED_TRANSITIONS::get)
                    .map(allowed -> allowed.contains(to))
                    .orElse(to.equals(CREATED));
        }

        public boolean isTerminal() {
            return TERMINAL_STATUSES.contains(this);
        }
    }

    private final DispatchConsumerImpl<K, V> consumer;

    /**
     * Creates a {@code DispatchConsumer} which commits offsets to Kafka.
     *
     * @param config
     *            {@code DispatchConsumer} configuration
     * @param strategy
     *            processing of a single message, called concurrently by many workers
     */
    public DispatchConsumer(DispatchConfig config, ProcessingStrategy<K, V> strategy) {
        this(config, strategy, null, null);
    }

    public DispatchConsumer(DispatchConfig config, ProcessingStrategy<K, V> strategy, ShutdownCallback callback) {
        this(config, strategy, null, callback);
    }

    /**
     * Creates a {@code DispatchConsumer}.
     *
     * @param config
     *            {@code DispatchConsumer} configuration
     * @param strategy
     *            processing of a single message, called concurrently by many workers
     * @param offsetStorage
     *            where processed offsets are committed and read from after a rebalance, Kafka if null
     * @param callback
     *            called once the instance is closed, may be null
     */
    public DispatchConsumer(
            DispatchConfig config,
            ProcessingStrategy<K, V> strategy,
            OffsetStorage offsetStorage,
            ShutdownCallback callback) {
        this.consumer = new DispatchConsumerImpl<>(config, strategy, offsetStorage, callback,
                () -> new KafkaConsumer<>(config.getConsumerConfigs()));
    }

    /**
     * Starts the consumer thread. Partitions are assigned and processed asynchronously.
     */
    public void start() {
        consumer.start();
    }

    /**
     * Requests a shutdown and waits until all worker pools are stopped and their offsets committed.
     */
    public void shutdown() {
        consumer.blockingShutdown();
    }

    public Status getStatus() {
        return consumer.getStatus();
    }

    /**
     * @return current message streams of the given topic, one per configured thread, some of them possibly idle
     */
    public List<MessageStream> getStreams(String topic) {
        return consumer.getStreams(topic);
    }

}
