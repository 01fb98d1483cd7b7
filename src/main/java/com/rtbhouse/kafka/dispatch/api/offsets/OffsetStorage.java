package com.rtbhouse.kafka.dispatch.api.offsets;

import java.util.OptionalLong;

import org.apache.kafka.common.TopicPartition;

/**
 * Durable storage of processed offsets. Offsets passed and returned here are offsets of the last processed messages,
 * not positions of the next messages to fetch.
 */
public interface OffsetStorage {

    /**
     * Stores the offset of the last processed message for the given partition. Any exception thrown is treated as a
     * failed commit.
     */
    void commit(TopicPartition partition, long offset);

    /**
     * @return offset of the last processed message for the given partition, empty if nothing was committed
     */
    OptionalLong fetchLast(TopicPartition partition);

}
