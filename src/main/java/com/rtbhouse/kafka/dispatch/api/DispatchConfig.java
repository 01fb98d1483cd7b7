package com.rtbhouse.kafka.dispatch.api;

import static com.google.common.base.Preconditions.checkState;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Range;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.rtbhouse.kafka.dispatch.api.pool.PoolFaultAction;
import com.rtbhouse.kafka.dispatch.impl.consumer.ConsumerThread;
import com.rtbhouse.kafka.dispatch.impl.pool.WorkerPool;

/**
 * {@link DispatchConsumer} configuration
 */
public class DispatchConfig extends AbstractConfig {

    /**
     * Should be used as a prefix for internal {@link KafkaConsumer} configuration used by {@link ConsumerThread}.
     */
    public static final String CONSUMER_PREFIX = "consumer.kafka.";

    /**
     * A list of kafka topics read by {@link ConsumerThread}.
     */
    public static final String CONSUMER_TOPICS = "consumer.topics";
    private static final String CONSUMER_TOPICS_DOC = "A list of kafka topics read by ConsumerThread.";

    /**
     * The number of message streams per topic. Partitions of a topic are spread across them. Streams only group and
     * name the partition pools: every partition is dispatched by its own thread, so this does not limit concurrency.
     */
    public static final String CONSUMER_THREADS_NUM = "consumer.threads.num";
    private static final String CONSUMER_THREADS_NUM_DOC = "The number of message streams per topic."
            + " A stream only groups partitions and names their pool threads, every partition still gets its own"
            + " dispatch thread and pool.workers.num workers, so this does not bound processing concurrency.";
    private static final int CONSUMER_THREADS_NUM_DEFAULT = 1;

    /**
     * Per-topic overrides of {@link #CONSUMER_THREADS_NUM} given as a list of {@code topic:threads} entries.
     */
    public static final String CONSUMER_TOPIC_THREADS = "consumer.topic.threads";
    private static final String CONSUMER_TOPIC_THREADS_DOC = "Per-topic overrides of " + CONSUMER_THREADS_NUM
            + " given as a list of topic:threads entries.";

    /**
     * The timeout in milliseconds for {@link KafkaConsumer}'s poll().
     */
    public static final String CONSUMER_POLL_TIMEOUT_MS = "consumer.poll.timeout.ms";
    private static final String CONSUMER_POLL_TIMEOUT_MS_DOC = "The timeout in milliseconds for KafkaConsumer's poll().";
    private static final long CONSUMER_POLL_TIMEOUT_MS_DEFAULT = Duration.of(1, ChronoUnit.SECONDS).toMillis();

    /**
     * The frequency in milliseconds that safely processed offsets are committed while pools are running. Pools always
     * commit when they are stopped, 0 disables intermediate commits.
     */
    public static final String CONSUMER_COMMIT_INTERVAL_MS = "consumer.commit.interval.ms";
    private static final String CONSUMER_COMMIT_INTERVAL_MS_DOC = "The frequency in milliseconds that safely processed"
            + " offsets are committed while pools are running (0 disables intermediate commits).";
    private static final long CONSUMER_COMMIT_INTERVAL_MS_DEFAULT = Duration.of(10, ChronoUnit.SECONDS).toMillis();

    /**
     * The number of retries in case of retriable commit failed exception.
     */
    public static final String CONSUMER_COMMIT_RETRIES = "consumer.commit.retries";
    private static final String CONSUMER_COMMIT_RETRIES_DOC = "The number of retries in case of retriable commit failed exception.";
    private static final int CONSUMER_COMMIT_RETRIES_DEFAULT = 3;

    /**
     * Time in milliseconds to wait for the consumer thread to stop all pools and close.
     */
    public static final String CONSUMER_SHUTDOWN_TIMEOUT_MS = "consumer.shutdown.timeout.ms";
    private static final String CONSUMER_SHUTDOWN_TIMEOUT_MS_DOC = "Time in milliseconds to wait for the consumer thread"
            + " to stop all pools and close.";
    private static final long CONSUMER_SHUTDOWN_TIMEOUT_MS_DEFAULT = Duration.ofMinutes(2).toMillis();

    /**
     * The number of workers in every {@link WorkerPool}.
     */
    public static final String POOL_WORKERS_NUM = "pool.workers.num";
    private static final String POOL_WORKERS_NUM_DOC = "The number of workers in every partition's worker pool.";
    private static final int POOL_WORKERS_NUM_DEFAULT = 10;

    /**
     * The timeout in milliseconds for a single task to be processed.
     */
    public static final String POOL_TASK_TIMEOUT_MS = "pool.task.timeout.ms";
    private static final String POOL_TASK_TIMEOUT_MS_DOC = "The timeout in milliseconds for a single task to be processed.";
    private static final long POOL_TASK_TIMEOUT_MS_DEFAULT = Duration.of(1, ChronoUnit.MINUTES).toMillis();

    /**
     * The number of times a failed or timed out task is dispatched again before it is considered resolved.
     */
    public static final String POOL_TASK_RETRIES = "pool.task.retries";
    private static final String POOL_TASK_RETRIES_DOC = "The number of times a failed or timed out task is dispatched"
            + " again before it is considered resolved.";
    private static final int POOL_TASK_RETRIES_DEFAULT = 0;

    /**
     * The number of failed or timed out tasks within {@link #POOL_FAILURE_WINDOW_MS} which faults a pool.
     */
    public static final String POOL_FAILURE_THRESHOLD = "pool.failure.threshold";
    private static final String POOL_FAILURE_THRESHOLD_DOC = "The number of failed or timed out tasks within "
            + "pool.failure.window.ms which faults a pool.";
    private static final int POOL_FAILURE_THRESHOLD_DEFAULT = 100;

    /**
     * The sliding time window in milliseconds in which failures are counted.
     */
    public static final String POOL_FAILURE_WINDOW_MS = "pool.failure.window.ms";
    private static final String POOL_FAILURE_WINDOW_MS_DOC = "The sliding time window in milliseconds in which failures are counted.";
    private static final long POOL_FAILURE_WINDOW_MS_DEFAULT = Duration.of(5, ChronoUnit.MINUTES).toMillis();

    /**
     * Action taken when a pool is faulted (shutdown_consumer, stop_partition).
     */
    public static final String POOL_FAULT_ACTION = "pool.fault.action";
    private static final String POOL_FAULT_ACTION_DOC = "Action taken when a pool is faulted (shutdown_consumer, stop_partition).";
    private static final String POOL_FAULT_ACTION_DEFAULT = PoolFaultAction.SHUTDOWN_CONSUMER.name();

    /**
     * The number of batches waiting in a pool's input queue above which its partition is paused.
     */
    public static final String POOL_QUEUE_MAX_BATCHES = "pool.queue.max.batches";
    private static final String POOL_QUEUE_MAX_BATCHES_DOC = "The number of batches waiting in a pool's input queue"
            + " above which its partition is paused.";
    private static final int POOL_QUEUE_MAX_BATCHES_DEFAULT = 4;

    /**
     * The time in milliseconds a pool waits for a batch or a free worker before it checks for shutdown.
     */
    public static final String POOL_POLL_TIMEOUT_MS = "pool.poll.timeout.ms";
    private static final String POOL_POLL_TIMEOUT_MS_DOC = "The time in milliseconds a pool waits for a batch or a free"
            + " worker before it checks for shutdown.";
    private static final long POOL_POLL_TIMEOUT_MS_DEFAULT = 100L;

    /**
     * Time in milliseconds to wait for a pool's dispatch loop to finish when the pool is stopped.
     */
    public static final String POOL_STOP_TIMEOUT_MS = "pool.stop.timeout.ms";
    private static final String POOL_STOP_TIMEOUT_MS_DOC = "Time in milliseconds to wait for a pool's dispatch loop to"
            + " finish when the pool is stopped.";
    private static final long POOL_STOP_TIMEOUT_MS_DEFAULT = Duration.ofSeconds(30).toMillis();

    private static final ConfigDef CONFIG;

    static {
        CONFIG = new ConfigDef()
                .define(CONSUMER_TOPICS,
                        Type.LIST,
                        Importance.HIGH,
                        CONSUMER_TOPICS_DOC)
                .define(CONSUMER_THREADS_NUM,
                        Type.INT,
                        CONSUMER_THREADS_NUM_DEFAULT,
                        Range.atLeast(1),
                        Importance.HIGH,
                        CONSUMER_THREADS_NUM_DOC)
                .define(CONSUMER_TOPIC_THREADS,
                        Type.LIST,
                        "",
                        (name, value) -> {
                            try {
                                parseTopicThreads(name, value);
                            } catch (IllegalArgumentException e) {
                                throw new ConfigException(name, value, e.getMessage());
                            }
                        },
                        Importance.MEDIUM,
                        CONSUMER_TOPIC_THREADS_DOC)
                .define(CONSUMER_POLL_TIMEOUT_MS,
                        Type.LONG,
                        CONSUMER_POLL_TIMEOUT_MS_DEFAULT,
                        Range.atLeast(0),
                        Importance.LOW,
                        CONSUMER_POLL_TIMEOUT_MS_DOC)
                .define(CONSUMER_COMMIT_INTERVAL_MS,
                        Type.LONG,
                        CONSUMER_COMMIT_INTERVAL_MS_DEFAULT,
                        Range.atLeast(0),
                        Importance.MEDIUM,
                        CONSUMER_COMMIT_INTERVAL_MS_DOC)
                .define(CONSUMER_COMMIT_RETRIES,
                        Type.INT,
                        CONSUMER_COMMIT_RETRIES_DEFAULT,
                        Range.atLeast(0),
                        Importance.LOW,
                        CONSUMER_COMMIT_RETRIES_DOC)
                .define(CONSUMER_SHUTDOWN_TIMEOUT_MS,
                        Type.LONG,
                        CONSUMER_SHUTDOWN_TIMEOUT_MS_DEFAULT,
                        Range.atLeast(1),
                        Importance.MEDIUM,
                        CONSUMER_SHUTDOWN_TIMEOUT_MS_DOC)
                .define(POOL_WORKERS_NUM,
                        Type.INT,
                        POOL_WORKERS_NUM_DEFAULT,
                        Range.atLeast(1),
                        Importance.HIGH,
                        POOL_WORKERS_NUM_DOC)
                .define(POOL_TASK_TIMEOUT_MS,
                        Type.LONG,
                        POOL_TASK_TIMEOUT_MS_DEFAULT,
                        Range.atLeast(1),
                        Importance.HIGH,
                        POOL_TASK_TIMEOUT_MS_DOC)
                .define(POOL_TASK_RETRIES,
                        Type.INT,
                        POOL_TASK_RETRIES_DEFAULT,
                        Range.atLeast(0),
                        Importance.MEDIUM,
                        POOL_TASK_RETRIES_DOC)
                .define(POOL_FAILURE_THRESHOLD,
                        Type.INT,
                        POOL_FAILURE_THRESHOLD_DEFAULT,
                        Range.atLeast(1),
                        Importance.MEDIUM,
                        POOL_FAILURE_THRESHOLD_DOC)
                .define(POOL_FAILURE_WINDOW_MS,
                        Type.LONG,
                        POOL_FAILURE_WINDOW_MS_DEFAULT,
                        Range.atLeast(1),
                        Importance.MEDIUM,
                        POOL_FAILURE_WINDOW_MS_DOC)
                .define(POOL_FAULT_ACTION,
                        Type.STRING,
                        POOL_FAULT_ACTION_DEFAULT,
                        (name, value) -> {
                            try {
                                PoolFaultAction.fromString((String) value);
                            } catch (IllegalArgumentException e) {
                                throw new ConfigException(name, value, "Unsupported value: " + value);
                            }
                        },
                        Importance.MEDIUM,
                        POOL_FAULT_ACTION_DOC)
                .define(POOL_QUEUE_MAX_BATCHES,
                        Type.INT,
                        POOL_QUEUE_MAX_BATCHES_DEFAULT,
                        Range.atLeast(1),
                        Importance.LOW,
                        POOL_QUEUE_MAX_BATCHES_DOC)
                .define(POOL_POLL_TIMEOUT_MS,
                        Type.LONG,
                        POOL_POLL_TIMEOUT_MS_DEFAULT,
                        Range.atLeast(1),
                        Importance.LOW,
                        POOL_POLL_TIMEOUT_MS_DOC)
                .define(POOL_STOP_TIMEOUT_MS,
                        Type.LONG,
                        POOL_STOP_TIMEOUT_MS_DEFAULT,
                        Range.atLeast(1),
                        Importance.LOW,
                        POOL_STOP_TIMEOUT_MS_DOC);
    }

    private static final Map<String, Object> CONSUMER_CONFIG_FINALS;

    static {
        final Map<String, Object> tmpConfigs = new HashMap<>();
        tmpConfigs.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        CONSUMER_CONFIG_FINALS = Collections.unmodifiableMap(tmpConfigs);
    }

    private final Map<String, Integer> topicThreads;

    public DispatchConfig(final Map<?, ?> props) {
        super(CONFIG, removePrefixAndOverride(props, "kafka.dispatch."));
        checkConfigFinals(CONSUMER_PREFIX, CONSUMER_CONFIG_FINALS);
        this.topicThreads = parseTopicThreads(CONSUMER_TOPIC_THREADS, getList(CONSUMER_TOPIC_THREADS));
    }

    private static Map<?, ?> removePrefixAndOverride(Map<?, ?> props, String prefix) {
        return overridingSum(List.of(
                propertiesWithoutPrefix(props, prefix),
                propertiesWithPrefix(props, prefix)
        ));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> propertiesWithoutPrefix(Map<?, ?> props, String prefix) {
        return (Map<String, Object>) Maps.filterKeys(props, key -> !((String) key).startsWith(prefix));
    }

    private static Map<String, Object> propertiesWithPrefix(Map<?, ?> props, String prefix) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        props.forEach((key, value) -> {
            String keyStr = (String) key;
            if (keyStr.startsWith(prefix)) {
                builder.put(keyStr.substring(prefix.length()), value);
            }
        });
        return builder.build();
    }

    private static Map<String, Object> overridingSum(Collection<Map<String, Object>> configs) {
        Map<String, Object> sum = new HashMap<>();
        configs.forEach(sum::putAll);
        return ImmutableMap.copyOf(sum);
    }

    private static Map<String, Integer> parseTopicThreads(String name, Object value) {
        ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
        if (value == null) {
            return builder.build();
        }
        for (Object entry : (List<?>) value) {
            String[] parts = entry.toString().trim().split(":");
            if (parts.length != 2 || parts[0].isEmpty()) {
                throw new IllegalArgumentException("Entry [" + entry + "] of " + name + " should be in topic:threads format");
            }
            int threads;
            try {
                threads = Integer.parseInt(parts[1].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Threads number of entry [" + entry + "] is not a number", e);
            }
            if (threads < 1) {
                throw new IllegalArgumentException("Threads number of entry [" + entry + "] should be positive");
            }
            builder.put(parts[0].trim(), threads);
        }
        return builder.build();
    }

    private void checkConfigFinals(String prefix, Map<String, Object> finals) {
        Map<String, Object> configs = originalsWithPrefix(prefix);
        for (Map.Entry<String, Object> override : finals.entrySet()) {
            var value = configs.get(override.getKey());
            checkState(value == null || value.toString().equals(override.getValue()), "Config [%s] should be set to [%s]",
                    prefix + override.getKey(), override.getValue());
        }
    }

    public Map<String, Object> getConsumerConfigs() {
        Map<String, Object> configs = originalsWithPrefix(CONSUMER_PREFIX);
        configs.putAll(CONSUMER_CONFIG_FINALS);
        return configs;
    }

    public List<String> getTopics() {
        return getList(CONSUMER_TOPICS);
    }

    public int getThreadsNum(String topic) {
        return topicThreads.getOrDefault(topic, getInt(CONSUMER_THREADS_NUM));
    }

    public Duration getConsumerPollTimeout() {
        return Duration.ofMillis(getLong(CONSUMER_POLL_TIMEOUT_MS));
    }

    public Duration getConsumerCommitInterval() {
        return Duration.ofMillis(getLong(CONSUMER_COMMIT_INTERVAL_MS));
    }

    public int getCommitRetries() {
        return getInt(CONSUMER_COMMIT_RETRIES);
    }

    public Duration getConsumerShutdownTimeout() {
        return Duration.ofMillis(getLong(CONSUMER_SHUTDOWN_TIMEOUT_MS));
    }

    public int getWorkersNum() {
        return getInt(POOL_WORKERS_NUM);
    }

    public Duration getTaskTimeout() {
        return Duration.ofMillis(getLong(POOL_TASK_TIMEOUT_MS));
    }

    public int getTaskRetries() {
        return getInt(POOL_TASK_RETRIES);
    }

    public int getFailureThreshold() {
        return getInt(POOL_FAILURE_THRESHOLD);
    }

    public Duration getFailureWindow() {
        return Duration.ofMillis(getLong(POOL_FAILURE_WINDOW_MS));
    }

    public PoolFaultAction getPoolFaultAction() {
        return PoolFaultAction.fromString(getString(POOL_FAULT_ACTION));
    }

    public int getPoolQueueMaxBatches() {
        return getInt(POOL_QUEUE_MAX_BATCHES);
    }

    public Duration getPoolPollTimeout() {
        return Duration.ofMillis(getLong(POOL_POLL_TIMEOUT_MS));
    }

    public Duration getPoolStopTimeout() {
        return Duration.ofMillis(getLong(POOL_STOP_TIMEOUT_MS));
    }
}
