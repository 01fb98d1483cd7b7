package com.rtbhouse.kafka.dispatch.impl.assign;

import java.util.Collection;
import java.util.List;

import org.apache.kafka.common.TopicPartition;

/**
 * Assigner used for spreading owned partitions across message streams (consumer thread slots).
 */
public interface PartitionAssigner {

    /**
     * Determines which partitions are consumed by which thread slot.
     *
     * @param partitions partitions owned by the consumer.
     * @param threads number of thread slots, positive.
     * @return list of exactly {@code threads} slots, each holding the partitions assigned to it; every partition is in
     *         exactly one slot and a slot is empty only if there are fewer partitions than threads.
     */
    List<List<TopicPartition>> assign(Collection<TopicPartition> partitions, int threads);
}
