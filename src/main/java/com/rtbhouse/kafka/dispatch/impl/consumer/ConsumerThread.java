package com.rtbhouse.kafka.dispatch.impl.consumer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.message.Message;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.impl.AbstractDispatchThread;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.Partitioned;
import com.rtbhouse.kafka.dispatch.impl.stream.StreamsManager;

/**
 * The only thread touching the {@link Consumer}: polls, routes per-partition batches to worker pools, pauses and
 * resumes partitions, and commits. Pools of revoked partitions are stopped (and committed) from the rebalance
 * listener, which runs inside {@code poll()}.
 */
public class ConsumerThread<K, V> extends AbstractDispatchThread implements Partitioned {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerThread.class);

    private final Duration consumerPollTimeout;
    private final long consumerCommitIntervalMs;

    private final StreamsManager<K, V> streamsManager;
    private final Consumer<K, V> kafkaConsumer;
    private final OffsetStorage offsetStorage;
    private final ConsumerRebalanceListenerImpl listener;

    // first offset handed to the current pool of a partition, used to rewind when nothing was committed yet
    private final Map<TopicPartition, Long> firstPushedOffsets = new HashMap<>();

    private long commitTime = System.currentTimeMillis();

    public ConsumerThread(
            DispatchConfig config,
            DispatchConsumerImpl<K, V> consumer,
            StreamsManager<K, V> streamsManager,
            Consumer<K, V> kafkaConsumer,
            OffsetStorage offsetStorage) {
        super("consumer-thread", config, consumer);

        this.consumerPollTimeout = config.getConsumerPollTimeout();
        this.consumerCommitIntervalMs = config.getConsumerCommitInterval().toMillis();

        this.streamsManager = streamsManager;
        this.kafkaConsumer = kafkaConsumer;
        this.offsetStorage = offsetStorage;
        this.listener = new ConsumerRebalanceListenerImpl(this);
    }

    @Override
    public void init() {
        kafkaConsumer.subscribe(config.getTopics(), listener);
    }

    @Override
    public void process() throws InterruptedException {
        ConsumerRecords<K, V> records;
        try {
            records = kafkaConsumer.poll(consumerPollTimeout);
        } catch (WakeupException e) {
            if (!shutdown) {
                throw new DispatchException("unexpected consumer wakeup", e);
            }
            logger.info("consumer wakeup because of shutdown");
            return;
        }
        listener.rethrowExceptionCaughtDuringRebalance();

        for (TopicPartition partition : records.partitions()) {
            List<ConsumerRecord<K, V>> partitionRecords = records.records(partition);
            List<Message<K, V>> batch = new ArrayList<>(partitionRecords.size());
            for (ConsumerRecord<K, V> record : partitionRecords) {
                batch.add(Message.of(record));
            }
            long firstOffset = batch.get(0).offset();
            if (streamsManager.push(partition, batch)) {
                firstPushedOffsets.putIfAbsent(partition, firstOffset);
            } else {
                // fetched again once the partition gets a pool which accepts it
                logger.info("batch for {} rejected, seeking back to offset {}", partition, firstOffset);
                kafkaConsumer.seek(partition, firstOffset);
            }
        }

        Set<TopicPartition> stoppedPartitions = streamsManager.stopFaultedPartitions();
        stoppedPartitions.forEach(this::seekToCommitted);

        Set<TopicPartition> partitionsToPause = streamsManager.getPartitionsToPause(kafkaConsumer.assignment(),
                kafkaConsumer.paused());
        if (!partitionsToPause.isEmpty()) {
            kafkaConsumer.pause(partitionsToPause);
            logger.info("paused partitions: {}", partitionsToPause);
        }

        Set<TopicPartition> partitionsToResume = streamsManager.getPartitionsToResume(kafkaConsumer.paused());
        if (!partitionsToResume.isEmpty()) {
            kafkaConsumer.resume(partitionsToResume);
            logger.info("resumed partitions: {}", partitionsToResume);
        }

        if (shouldCommitNow()) {
            streamsManager.commitProcessed();
        }
    }

    @Override
    public void close() {
        try {
            streamsManager.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("interrupted while stopping worker pools", e);
        } finally {
            kafkaConsumer.close();
        }
    }

    @Override
    public void shutdown(DispatchException exception) {
        super.shutdown(exception);
        kafkaConsumer.wakeup();
    }

    @Override
    public void register(Collection<TopicPartition> partitions) throws InterruptedException {
        streamsManager.register(partitions);
        Set<TopicPartition> toSeek = new HashSet<>(partitions);
        toSeek.addAll(streamsManager.takeRestartedPartitions());
        toSeek.forEach(this::seekToCommitted);
    }

    @Override
    public void unregister(Collection<TopicPartition> partitions) throws InterruptedException {
        streamsManager.unregister(partitions);
        firstPushedOffsets.keySet().removeAll(partitions);
        streamsManager.takeRestartedPartitions().forEach(this::seekToCommitted);
    }

    private void seekToCommitted(TopicPartition partition) {
        OptionalLong lastOffset = offsetStorage.fetchLast(partition);
        Long firstPushed = firstPushedOffsets.remove(partition);
        if (lastOffset.isPresent()) {
            logger.info("seeking {} to offset {}", partition, lastOffset.getAsLong() + 1);
            kafkaConsumer.seek(partition, lastOffset.getAsLong() + 1);
        } else if (firstPushed != null) {
            logger.info("nothing committed for {}, seeking back to offset {}", partition, firstPushed);
            kafkaConsumer.seek(partition, firstPushed);
        }
    }

    private boolean shouldCommitNow() {
        if (consumerCommitIntervalMs <= 0) {
            return false;
        }
        long currentTime = System.currentTimeMillis();
        if (currentTime - commitTime > consumerCommitIntervalMs) {
            commitTime = currentTime;
            return true;
        }
        return false;
    }
}
