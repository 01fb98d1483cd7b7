package com.rtbhouse.kafka.dispatch.api.message;

import java.util.Objects;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;

/**
 * Immutable message fetched from a single partition. Identifies one position in the partition's log.
 */
public final class Message<K, V> {

    private final String topic;
    private final int partition;
    private final long offset;
    private final K key;
    private final V value;

    public Message(String topic, int partition, long offset, K key, V value) {
        this.topic = Objects.requireNonNull(topic);
        this.partition = partition;
        this.offset = offset;
        this.key = key;
        this.value = value;
    }

    public static <K, V> Message<K, V> of(ConsumerRecord<K, V> record) {
        return new Message<>(record.topic(), record.partition(), record.offset(), record.key(), record.value());
    }

    public String topic() {
        return topic;
    }

    public int partition() {
        return partition;
    }

    public long offset() {
        return offset;
    }

    public K key() {
        return key;
    }

    public V value() {
        return value;
    }

    public TopicPartition topicPartition() {
        return new TopicPartition(topic, partition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Message<?, ?> other = (Message<?, ?>) o;
        return partition == other.partition && offset == other.offset && topic.equals(other.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, partition, offset);
    }

    @Override
    public String toString() {
        return "Message{topic=" + topic + ", partition=" + partition + ", offset=" + offset + "}";
    }
}
