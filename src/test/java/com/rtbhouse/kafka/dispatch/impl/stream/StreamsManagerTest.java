package com.rtbhouse.kafka.dispatch.impl.stream;

import static com.rtbhouse.kafka.dispatch.test.utils.TestConfigs.TOPIC;
import static com.rtbhouse.kafka.dispatch.test.utils.TestConfigs.config;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import org.apache.kafka.common.TopicPartition;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.message.Message;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.api.task.TaskResult;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.assign.RoundRobinPartitionAssigner;
import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;
import com.rtbhouse.kafka.dispatch.impl.pool.WorkerPool;

@RunWith(MockitoJUnitRunner.class)
public class StreamsManagerTest {

    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
    private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);
    private static final TopicPartition P2 = new TopicPartition(TOPIC, 2);

    @Mock
    private DispatchConsumerImpl<String, String> consumer;

    @Mock
    private OffsetStorage offsetStorage;

    private final CountDownLatch release = new CountDownLatch(1);
    private StreamsManager<String, String> streamsManager;

    @After
    public void tearDown() throws InterruptedException {
        release.countDown();
        if (streamsManager != null) {
            streamsManager.close();
        }
    }

    @Test
    public void shouldSpreadPartitionsAcrossStreams() throws InterruptedException {
        streamsManager = streamsManager(config(DispatchConfig.CONSUMER_THREADS_NUM, 2), successful());

        streamsManager.register(List.of(P2, P0, P1));

        List<MessageStream> streams = streamsManager.streams(TOPIC);
        assertThat(streams).extracting(MessageStream::id).containsExactly("topic-stream-0", "topic-stream-1");
        assertThat(streams.get(0).partitions()).containsExactly(P0, P2);
        assertThat(streams.get(1).partitions()).containsExactly(P1);
        assertThat(streamsManager.pool(P0)).isPresent();
        assertThat(streamsManager.pool(P1)).isPresent();
        assertThat(streamsManager.pool(P2)).isPresent();
    }

    @Test
    public void shouldKeepIdleStreamWhenThereAreMoreThreadsThanPartitions() throws InterruptedException {
        streamsManager = streamsManager(config(DispatchConfig.CONSUMER_THREADS_NUM, 4), successful());

        streamsManager.register(List.of(P0, P1, P2));

        List<MessageStream> streams = streamsManager.streams(TOPIC);
        assertThat(streams).hasSize(4);
        assertThat(streams).filteredOn(MessageStream::isIdle).hasSize(1);
    }

    @Test
    public void shouldUsePerTopicThreadsNumber() throws InterruptedException {
        streamsManager = streamsManager(config(
                DispatchConfig.CONSUMER_TOPICS, "topic,other",
                DispatchConfig.CONSUMER_THREADS_NUM, 1,
                DispatchConfig.CONSUMER_TOPIC_THREADS, "other:3"), successful());

        streamsManager.register(List.of(P0, new TopicPartition("other", 0)));

        assertThat(streamsManager.streams(TOPIC)).hasSize(1);
        assertThat(streamsManager.streams("other")).hasSize(3);
        assertThat(streamsManager.streams("unknown")).isEmpty();
    }

    @Test
    public void shouldRouteMessagesOnlyToWorkersOfTheirStream() throws InterruptedException {
        Map<String, Set<TopicPartition>> seenByStream = new ConcurrentHashMap<>();
        Set<Long> processed = ConcurrentHashMap.newKeySet();
        AtomicInteger misrouted = new AtomicInteger();
        streamsManager = streamsManager(config(DispatchConfig.CONSUMER_THREADS_NUM, 2), (worker, message, taskId) -> {
            seenByStream.computeIfAbsent(worker.streamId(), id -> ConcurrentHashMap.newKeySet())
                    .add(message.topicPartition());
            if (!worker.topicPartition().equals(message.topicPartition())) {
                misrouted.incrementAndGet();
            }
            processed.add(message.partition() * 100L + message.offset());
            return TaskResult.successful(taskId);
        });
        streamsManager.register(List.of(P0, P1, P2));

        for (TopicPartition partition : List.of(P0, P1, P2)) {
            assertThat(streamsManager.push(partition, batch(partition, 0, 9))).isTrue();
        }

        await().atMost(5, SECONDS).until(() -> processed.size() == 30);
        assertThat(misrouted.get()).isZero();
        for (MessageStream stream : streamsManager.streams(TOPIC)) {
            assertThat(seenByStream.get(stream.id())).containsExactlyInAnyOrderElementsOf(stream.partitions());
        }
    }

    @Test
    public void shouldCommitAndDropPoolsOfRevokedPartitions() throws InterruptedException {
        streamsManager = streamsManager(config(), successful());
        streamsManager.register(List.of(P0, P1));
        streamsManager.push(P0, batch(P0, 0, 2));
        WorkerPool<String, String> pool = streamsManager.pool(P0).get();
        await().atMost(5, SECONDS).until(() -> pool.committableOffset() == 2L);

        streamsManager.unregister(List.of(P0, P1));

        verify(offsetStorage).commit(P0, 2L);
        verify(offsetStorage, never()).commit(eq(P1), anyLong());
        assertThat(streamsManager.pool(P0)).isEmpty();
        assertThat(streamsManager.push(P0, batch(P0, 3, 3))).isFalse();
        assertThat(streamsManager.streams(TOPIC)).allMatch(MessageStream::isIdle);
    }

    @Test
    public void shouldRestartPoolOfPartitionMovedToAnotherStream() throws InterruptedException {
        streamsManager = streamsManager(config(DispatchConfig.CONSUMER_THREADS_NUM, 2), successful());
        streamsManager.register(List.of(P1));
        assertThat(streamsManager.streams(TOPIC).get(0).partitions()).containsExactly(P1);
        streamsManager.push(P1, batch(P1, 0, 1));
        WorkerPool<String, String> oldPool = streamsManager.pool(P1).get();
        await().atMost(5, SECONDS).until(() -> oldPool.committableOffset() == 1L);

        streamsManager.register(List.of(P0));

        verify(offsetStorage).commit(P1, 1L);
        assertThat(streamsManager.streams(TOPIC).get(0).partitions()).containsExactly(P0);
        assertThat(streamsManager.streams(TOPIC).get(1).partitions()).containsExactly(P1);
        assertThat(streamsManager.pool(P1)).isPresent().get().isNotSameAs(oldPool);
        assertThat(streamsManager.takeRestartedPartitions()).containsExactly(P1);
        assertThat(streamsManager.takeRestartedPartitions()).isEmpty();
    }

    @Test
    public void shouldCommitOnlyAdvancedOffsets() throws InterruptedException {
        streamsManager = streamsManager(config(), successful());
        streamsManager.register(List.of(P0));
        streamsManager.push(P0, batch(P0, 0, 3));
        WorkerPool<String, String> pool = streamsManager.pool(P0).get();
        await().atMost(5, SECONDS).until(() -> pool.committableOffset() == 3L);

        streamsManager.commitProcessed();
        streamsManager.commitProcessed();

        verify(offsetStorage, times(1)).commit(P0, 3L);
    }

    @Test
    public void shouldPauseFullPartitionAndResumeItOnceDrained() throws InterruptedException {
        streamsManager = streamsManager(config(
                DispatchConfig.POOL_WORKERS_NUM, 1,
                DispatchConfig.POOL_QUEUE_MAX_BATCHES, 1), (worker, message, taskId) -> {
                    awaitRelease();
                    return TaskResult.successful(taskId);
                });
        streamsManager.register(List.of(P0));
        WorkerPool<String, String> pool = streamsManager.pool(P0).get();

        streamsManager.push(P0, batch(P0, 0, 0));
        streamsManager.push(P0, batch(P0, 1, 1));
        await().atMost(5, SECONDS).until(() -> pool.queuedBatches() == 0);
        streamsManager.push(P0, batch(P0, 2, 2));

        assertThat(streamsManager.getPartitionsToPause(Set.of(P0), Set.of())).containsExactly(P0);
        assertThat(streamsManager.getPartitionsToPause(Set.of(P0), Set.of(P0))).isEmpty();
        assertThat(streamsManager.getPartitionsToResume(Set.of(P0))).isEmpty();

        release.countDown();
        await().atMost(5, SECONDS).until(() -> pool.committableOffset() == 2L);
        assertThat(streamsManager.getPartitionsToResume(Set.of(P0))).containsExactly(P0);
    }

    @Test
    public void shouldStopFaultedPartitionWhenConfigured() throws InterruptedException {
        streamsManager = streamsManager(config(
                DispatchConfig.POOL_FAULT_ACTION, "stop_partition",
                DispatchConfig.POOL_FAILURE_THRESHOLD, 1), failing());
        streamsManager.register(List.of(P0, P1));
        WorkerPool<String, String> pool = streamsManager.pool(P0).get();

        streamsManager.push(P0, batch(P0, 0, 0));
        await().atMost(5, SECONDS).until(pool::isFaulted);

        assertThat(streamsManager.getPartitionsToPause(Set.of(P0, P1), Set.of())).containsExactly(P0);
        assertThat(streamsManager.stopFaultedPartitions()).containsExactly(P0);
        verify(offsetStorage).commit(P0, 0L);
        assertThat(streamsManager.pool(P0)).isEmpty();
        assertThat(streamsManager.pool(P1)).isPresent();
        assertThat(streamsManager.push(P0, batch(P0, 1, 1))).isFalse();
        assertThat(streamsManager.getPartitionsToResume(Set.of(P0))).isEmpty();
        verify(consumer, never()).shutdown(any());
    }

    @Test
    public void shouldRestartStoppedPartitionOnIncrementalRebalanceKeepingIt() throws InterruptedException {
        streamsManager = streamsManager(config(
                DispatchConfig.POOL_FAULT_ACTION, "stop_partition",
                DispatchConfig.POOL_FAILURE_THRESHOLD, 1), failing());
        streamsManager.register(List.of(P0));
        WorkerPool<String, String> pool = streamsManager.pool(P0).get();
        streamsManager.push(P0, batch(P0, 0, 0));
        await().atMost(5, SECONDS).until(pool::isFaulted);
        assertThat(streamsManager.stopFaultedPartitions()).containsExactly(P0);
        streamsManager.takeRestartedPartitions();

        // only the newly added partition is reported, P0 is kept without being revoked
        streamsManager.register(List.of(P1));

        assertThat(streamsManager.pool(P0)).isPresent();
        assertThat(streamsManager.pool(P0).get()).isNotSameAs(pool);
        assertThat(streamsManager.pool(P1)).isPresent();
        assertThat(streamsManager.takeRestartedPartitions()).contains(P0);
        assertThat(streamsManager.getPartitionsToResume(Set.of(P0))).containsExactly(P0);
    }

    @Test
    public void shouldShutdownConsumerOnFaultByDefault() throws InterruptedException {
        streamsManager = streamsManager(config(DispatchConfig.POOL_FAILURE_THRESHOLD, 1), failing());
        streamsManager.register(List.of(P0));

        streamsManager.push(P0, batch(P0, 0, 0));

        verify(consumer, timeout(5000)).shutdown(any(PoolFaultException.class));
        assertThat(streamsManager.stopFaultedPartitions()).isEmpty();
    }

    private StreamsManager<String, String> streamsManager(DispatchConfig config,
            ProcessingStrategy<String, String> strategy) {
        return new StreamsManager<>(config, consumer, strategy, offsetStorage, new RoundRobinPartitionAssigner());
    }

    private static ProcessingStrategy<String, String> successful() {
        return (worker, message, taskId) -> TaskResult.successful(taskId);
    }

    private static ProcessingStrategy<String, String> failing() {
        return (worker, message, taskId) -> TaskResult.processingFailed(taskId);
    }

    private void awaitRelease() {
        try {
            release.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<Message<String, String>> batch(TopicPartition partition, long from, long to) {
        return LongStream.rangeClosed(from, to)
                .mapToObj(offset -> new Message<>(partition.topic(), partition.partition(), offset, "key", "value"))
                .collect(Collectors.toList());
    }
}
