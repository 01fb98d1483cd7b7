package com.rtbhouse.kafka.dispatch.impl.stream;

import java.util.List;

import org.apache.kafka.common.TopicPartition;

/**
 * One slot of a topic together with the partitions currently assigned to it. A slot is a grouping label: each of its
 * partitions is dispatched by its own pool thread. A stream without partitions stays idle until the next rebalance.
 */
public final class MessageStream {

    private final String topic;
    private final int index;
    private final List<TopicPartition> partitions;

    public MessageStream(String topic, int index, List<TopicPartition> partitions) {
        this.topic = topic;
        this.index = index;
        this.partitions = List.copyOf(partitions);
    }

    public static String id(String topic, int index) {
        return topic + "-stream-" + index;
    }

    public String id() {
        return id(topic, index);
    }

    public String topic() {
        return topic;
    }

    public int index() {
        return index;
    }

    public List<TopicPartition> partitions() {
        return partitions;
    }

    public boolean isIdle() {
        return partitions.isEmpty();
    }

    @Override
    public String toString() {
        return id() + partitions;
    }
}
