package com.rtbhouse.kafka.dispatch.impl;

import static com.rtbhouse.kafka.dispatch.test.utils.TestConfigs.TOPIC;
import static com.rtbhouse.kafka.dispatch.test.utils.TestConfigs.config;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.DispatchConsumer.Status;
import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.ShutdownCallback;
import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.api.task.TaskResult;
import com.rtbhouse.kafka.dispatch.impl.errors.BadStatusException;
import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;
import com.rtbhouse.kafka.dispatch.impl.stream.MessageStream;

@RunWith(MockitoJUnitRunner.class)
public class DispatchConsumerImplTest {

    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
    private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);

    @Mock
    private OffsetStorage offsetStorage;

    @Mock
    private ShutdownCallback callback;

    private final MockConsumer<String, String> kafkaConsumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    private final Set<String> processed = ConcurrentHashMap.newKeySet();

    @Test
    public void shouldProcessAssignedPartitionsAndCloseGracefully() {
        DispatchConsumerImpl<String, String> dispatchConsumer = dispatchConsumer(
                config(DispatchConfig.CONSUMER_THREADS_NUM, 2), recording());
        assignWithRecords(3);

        dispatchConsumer.start();
        assertThat(dispatchConsumer.getStatus()).isIn(Status.STARTED, Status.SHUTDOWN);
        await().atMost(5, SECONDS).until(() -> processed.size() == 6);

        List<MessageStream> streams = dispatchConsumer.getStreams(TOPIC);
        assertThat(streams).extracting(MessageStream::partitions).containsExactly(List.of(P0), List.of(P1));

        dispatchConsumer.blockingShutdown();

        assertThat(dispatchConsumer.getStatus()).isEqualTo(Status.CLOSED_GRACEFULLY);
        assertThat(kafkaConsumer.closed()).isTrue();
        verify(offsetStorage).commit(P0, 2L);
        verify(offsetStorage).commit(P1, 2L);
        verify(callback).onShutdown(null);
    }

    @Test
    public void shouldShutdownWithPoolFault() {
        DispatchConsumerImpl<String, String> dispatchConsumer = dispatchConsumer(
                config(DispatchConfig.POOL_FAILURE_THRESHOLD, 1),
                (worker, message, taskId) -> TaskResult.processingFailed(taskId));
        assignWithRecords(3);

        dispatchConsumer.start();

        await().atMost(10, SECONDS).until(() -> dispatchConsumer.getStatus().isTerminal());
        ArgumentCaptor<DispatchException> exception = ArgumentCaptor.forClass(DispatchException.class);
        verify(callback, timeout(5000)).onShutdown(exception.capture());
        assertThat(exception.getValue()).isInstanceOf(PoolFaultException.class);
        assertThat(dispatchConsumer.getException()).isSameAs(exception.getValue());
        assertThat(dispatchConsumer.getStatus()).isEqualTo(Status.CLOSED_GRACEFULLY);
        verify(offsetStorage).commit(eq(P0), anyLong());
        assertThat(kafkaConsumer.closed()).isTrue();
    }

    @Test
    public void shouldNotStartTwice() {
        DispatchConsumerImpl<String, String> dispatchConsumer = dispatchConsumer(config(), recording());
        dispatchConsumer.start();

        assertThatThrownBy(dispatchConsumer::start).isInstanceOf(BadStatusException.class);

        dispatchConsumer.blockingShutdown();
        assertThat(dispatchConsumer.getStatus().isTerminal()).isTrue();
    }

    @Test
    public void shouldIgnoreShutdownBeforeStart() {
        DispatchConsumerImpl<String, String> dispatchConsumer = dispatchConsumer(config(), recording());

        dispatchConsumer.shutdown(null);

        assertThat(dispatchConsumer.getStatus()).isEqualTo(Status.CREATED);
        assertThat(dispatchConsumer.getStreams(TOPIC)).isEmpty();
    }

    private DispatchConsumerImpl<String, String> dispatchConsumer(DispatchConfig config,
            ProcessingStrategy<String, String> strategy) {
        return new DispatchConsumerImpl<>(config, strategy, offsetStorage, callback, () -> kafkaConsumer);
    }

    private ProcessingStrategy<String, String> recording() {
        return (worker, message, taskId) -> {
            processed.add(message.partition() + ":" + message.offset());
            return TaskResult.successful(taskId);
        };
    }

    private void assignWithRecords(int countPerPartition) {
        kafkaConsumer.schedulePollTask(() -> {
            kafkaConsumer.rebalance(List.of(P0, P1));
            kafkaConsumer.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
            for (TopicPartition partition : List.of(P0, P1)) {
                for (long offset = 0; offset < countPerPartition; offset++) {
                    kafkaConsumer.addRecord(new ConsumerRecord<>(TOPIC, partition.partition(), offset, "key", "value"));
                }
            }
        });
    }
}
