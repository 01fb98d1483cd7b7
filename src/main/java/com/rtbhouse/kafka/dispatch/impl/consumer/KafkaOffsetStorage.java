package com.rtbhouse.kafka.dispatch.impl.consumer;

import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.offsets.OffsetStorage;
import com.rtbhouse.kafka.dispatch.impl.errors.FailedCommitException;

/**
 * {@link OffsetStorage} backed by the consumer group's committed offsets. Kafka stores the position of the next
 * message to fetch, so offsets are shifted by one in both directions.
 * <p>
 * It uses the {@link Consumer} directly and therefore must only be called from the consumer thread.
 */
public class KafkaOffsetStorage implements OffsetStorage {

    private static final Logger logger = LoggerFactory.getLogger(KafkaOffsetStorage.class);

    private final Consumer<?, ?> consumer;
    private final int maxRetries;

    public KafkaOffsetStorage(Consumer<?, ?> consumer, int maxRetries) {
        this.consumer = consumer;
        this.maxRetries = maxRetries;
    }

    @Override
    public void commit(TopicPartition partition, long offset) {
        Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(partition, new OffsetAndMetadata(offset + 1));
        int failureNum = 0;
        while (true) {
            try {
                commitSync(offsets);
                logger.debug("commit succeeded, offsets: {}", offsets);
                return;
            } catch (RetriableException | RebalanceInProgressException e) {
                failureNum++;
                if (failureNum > maxRetries) {
                    logger.error("retriable commit failed exception: {}, offsets: {}, failureNum: {}/{}",
                            e, offsets, failureNum, maxRetries);
                    throw new FailedCommitException(e);
                }
                logger.warn("retriable commit failed exception: {}, offsets: {}, failureNum: {}/{}",
                        e, offsets, failureNum, maxRetries);
            } catch (KafkaException e) {
                logger.error("commit failed exception: {}, offsets: {}", e, offsets);
                throw new FailedCommitException(e);
            }
        }
    }

    private void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
        try {
            consumer.commitSync(offsets);
        } catch (WakeupException e) {
            // this has to be repeated if consumer.wakeup() during thread shutdown hasn't woken up any pending poll
            // operation
            consumer.commitSync(offsets);
        }
    }

    @Override
    public OptionalLong fetchLast(TopicPartition partition) {
        OffsetAndMetadata committed;
        try {
            committed = consumer.committed(Set.of(partition)).get(partition);
        } catch (WakeupException e) {
            committed = consumer.committed(Set.of(partition)).get(partition);
        }
        if (committed == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(committed.offset() - 1);
    }
}
