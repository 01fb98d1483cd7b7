package com.rtbhouse.kafka.dispatch.impl.stream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.message.Message;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.Partitioned;
import com.rtbhouse.kafka.dispatch.impl.assign.PartitionAssigner;
import com.rtbhouse.kafka.dispatch.impl.errors.FailedCommitException;
import com.rtbhouse.kafka.dispatch.impl.pool.PoolFaultHandler;
import com.rtbhouse.kafka.dispatch.impl.pool.PoolFaultHandlerFactory;
import com.rtbhouse.kafka.dispatch.impl.pool.WorkerPool;

/**
 * Keeps one {@link WorkerPool} per owned partition and spreads the partitions of every topic across its
 * {@link MessageStream}s. Apart from {@link #markFaulted(TopicPartition)} and {@link #streams(String)} all methods are
 * called by the consumer thread only.
 */
public class StreamsManager<K, V> implements Partitioned {

    private static final Logger logger = LoggerFactory.getLogger(StreamsManager.class);

    private static final Comparator<TopicPartition> COMPARATOR = Comparator.comparing(TopicPartition::topic)
            .thenComparingInt(TopicPartition::partition);

    private final DispatchConfig config;
    private final DispatchConsumerImpl<K, V> consumer;
    private final ProcessingStrategy<K, V> strategy;
    private final OffsetStorage offsetStorage;
    private final PartitionAssigner assigner;
    private final PoolFaultHandler faultHandler;
    private final int maxQueuedBatches;

    private final Set<TopicPartition> owned = new HashSet<>();
    private final Map<TopicPartition, WorkerPool<K, V>> pools = new HashMap<>();
    private final Map<TopicPartition, String> poolStreams = new HashMap<>();
    // faulted partitions whose pools are already stopped, they are not consumed until the next rebalance
    private final Set<TopicPartition> stoppedPartitions = new HashSet<>();
    private final Map<TopicPartition, Long> committedOffsets = new HashMap<>();
    // partitions moved to another stream, their consumer position has to be rewound to the committed offset
    private final Set<TopicPartition> restartedPartitions = new HashSet<>();

    private final Queue<TopicPartition> faultedPartitions = new ConcurrentLinkedQueue<>();
    private volatile Map<String, List<MessageStream>> streams = Map.of();

    public StreamsManager(
            DispatchConfig config,
            DispatchConsumerImpl<K, V> consumer,
            ProcessingStrategy<K, V> strategy,
            OffsetStorage offsetStorage,
            PartitionAssigner assigner) {
        this.config = config;
        this.consumer = consumer;
        this.strategy = strategy;
        this.offsetStorage = offsetStorage;
        this.assigner = assigner;
        this.faultHandler = PoolFaultHandlerFactory.create(config.getPoolFaultAction(), consumer, this);
        this.maxQueuedBatches = config.getPoolQueueMaxBatches();
    }

    @Override
    public void register(Collection<TopicPartition> partitions) throws InterruptedException {
        logger.info("partitions registered: {}", partitions);
        owned.addAll(partitions);
        Set<String> topics = new HashSet<>(topicsOf(partitions));
        topics.addAll(topicsOf(releaseStoppedPartitions()));
        reassign(topics);
    }

    // an incremental rebalance does not revoke kept partitions, so faulted ones are released on every assignment
    private Set<TopicPartition> releaseStoppedPartitions() {
        Set<TopicPartition> released = new HashSet<>(stoppedPartitions);
        released.retainAll(owned);
        stoppedPartitions.clear();
        if (!released.isEmpty()) {
            logger.info("faulted partitions released by rebalance: {}", released);
            restartedPartitions.addAll(released);
        }
        return released;
    }

    @Override
    public void unregister(Collection<TopicPartition> partitions) throws InterruptedException {
        logger.info("partitions unregistered: {}", partitions);
        // a revoked partition has to be committed before anybody else starts consuming it
        stopPools(partitions);
        owned.removeAll(partitions);
        stoppedPartitions.removeAll(partitions);
        committedOffsets.keySet().removeAll(partitions);
        restartedPartitions.removeAll(partitions);
        reassign(topicsOf(partitions));
    }

    private void reassign(Set<String> topics) throws InterruptedException {
        Map<String, List<MessageStream>> newStreams = new HashMap<>(streams);
        for (String topic : topics) {
            List<TopicPartition> topicPartitions = owned.stream()
                    .filter(partition -> partition.topic().equals(topic))
                    .sorted(COMPARATOR)
                    .collect(Collectors.toList());
            List<List<TopicPartition>> slots = assigner.assign(topicPartitions, config.getThreadsNum(topic));

            List<MessageStream> topicStreams = new ArrayList<>(slots.size());
            Map<TopicPartition, String> targetStreams = new HashMap<>();
            for (int index = 0; index < slots.size(); index++) {
                MessageStream stream = new MessageStream(topic, index, slots.get(index));
                topicStreams.add(stream);
                stream.partitions().forEach(partition -> targetStreams.put(partition, stream.id()));
            }

            // a partition moved to another stream gets a new pool, the old one has to commit first
            List<TopicPartition> moved = poolStreams.entrySet().stream()
                    .filter(entry -> entry.getKey().topic().equals(topic))
                    .filter(entry -> !entry.getValue().equals(targetStreams.get(entry.getKey())))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            stopPools(moved);
            moved.stream().filter(owned::contains).forEach(restartedPartitions::add);

            for (TopicPartition partition : topicPartitions) {
                if (!pools.containsKey(partition) && !stoppedPartitions.contains(partition)) {
                    startPool(partition, targetStreams.get(partition));
                }
            }
            newStreams.put(topic, List.copyOf(topicStreams));
            logger.info("topic {} assigned to streams: {}", topic, topicStreams);
        }
        streams = Map.copyOf(newStreams);
    }

    private void startPool(TopicPartition partition, String streamId) {
        WorkerPool<K, V> pool = new WorkerPool<>(streamId + "-" + partition, streamId, config, consumer, partition,
                strategy, offsetStorage, faultHandler);
        pools.put(partition, pool);
        poolStreams.put(partition, streamId);
        pool.start();
    }

    private void stopPools(Collection<TopicPartition> partitions) throws InterruptedException {
        List<WorkerPool<K, V>> stopping = partitions.stream()
                .map(pools::remove)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (stopping.isEmpty()) {
            return;
        }
        stopping.forEach(pool -> poolStreams.remove(pool.partition()));
        // lets all dispatch loops finish in parallel before pools are stopped one by one
        stopping.forEach(WorkerPool::shutdown);

        DispatchException failure = null;
        for (WorkerPool<K, V> pool : stopping) {
            try {
                pool.stopPool().get();
            } catch (ExecutionException e) {
                logger.error("could not stop pool {}", pool.id(), e.getCause());
                if (failure == null) {
                    failure = wrapIfNeeded(e.getCause());
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Queues a batch for the partition's pool.
     *
     * @return false if there is no pool accepting batches for the partition
     */
    public boolean push(TopicPartition partition, List<Message<K, V>> batch) {
        WorkerPool<K, V> pool = pools.get(partition);
        return pool != null && pool.offer(batch);
    }

    public Set<TopicPartition> getPartitionsToPause(Set<TopicPartition> assigned, Set<TopicPartition> paused) {
        return assigned.stream()
                .filter(partition -> !paused.contains(partition))
                .filter(partition -> {
                    WorkerPool<K, V> pool = pools.get(partition);
                    return pool == null || pool.isFaulted() || pool.queuedBatches() >= maxQueuedBatches;
                })
                .collect(Collectors.toSet());
    }

    public Set<TopicPartition> getPartitionsToResume(Set<TopicPartition> paused) {
        return paused.stream()
                .filter(partition -> {
                    WorkerPool<K, V> pool = pools.get(partition);
                    return pool != null && !pool.isFaulted() && pool.queuedBatches() < maxQueuedBatches;
                })
                .collect(Collectors.toSet());
    }

    /**
     * @return partitions whose pools were restarted on another stream since the previous call
     */
    public Set<TopicPartition> takeRestartedPartitions() {
        Set<TopicPartition> restarted = Set.copyOf(restartedPartitions);
        restartedPartitions.clear();
        return restarted;
    }

    public void markFaulted(TopicPartition partition) {
        faultedPartitions.add(partition);
    }

    /**
     * Stops the pools of partitions reported by {@link #markFaulted(TopicPartition)}.
     *
     * @return partitions which have just been stopped
     */
    public Set<TopicPartition> stopFaultedPartitions() throws InterruptedException {
        Set<TopicPartition> stopped = new HashSet<>();
        TopicPartition partition;
        while ((partition = faultedPartitions.poll()) != null) {
            if (pools.containsKey(partition)) {
                stopped.add(partition);
            }
        }
        if (!stopped.isEmpty()) {
            logger.warn("stopping faulted partitions: {}", stopped);
            stoppedPartitions.addAll(stopped);
            stopPools(stopped);
        }
        return stopped;
    }

    /**
     * Commits offsets which every running pool has safely processed since the previous call.
     */
    public void commitProcessed() {
        for (Map.Entry<TopicPartition, WorkerPool<K, V>> entry : pools.entrySet()) {
            TopicPartition partition = entry.getKey();
            long offset = entry.getValue().committableOffset();
            if (offset == WorkerPool.NO_OFFSET || offset <= committedOffsets.getOrDefault(partition, WorkerPool.NO_OFFSET)) {
                continue;
            }
            try {
                offsetStorage.commit(partition, offset);
            } catch (FailedCommitException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FailedCommitException("commit of offset " + offset + " for " + partition + " failed", e);
            }
            logger.debug("committed offset {} for {}", offset, partition);
            committedOffsets.put(partition, offset);
        }
    }

    public void close() throws InterruptedException {
        logger.info("stopping all pools: {}", pools.keySet());
        stopPools(new ArrayList<>(pools.keySet()));
    }

    public List<MessageStream> streams(String topic) {
        return streams.getOrDefault(topic, List.of());
    }

    public Optional<WorkerPool<K, V>> pool(TopicPartition partition) {
        return Optional.ofNullable(pools.get(partition));
    }

    private static Set<String> topicsOf(Collection<TopicPartition> partitions) {
        return partitions.stream().map(TopicPartition::topic).collect(Collectors.toSet());
    }

    private static DispatchException wrapIfNeeded(Throwable e) {
        return (e instanceof DispatchException) ? (DispatchException) e : new DispatchException(e);
    }
}
