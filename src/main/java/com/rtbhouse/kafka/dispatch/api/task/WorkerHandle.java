package com.rtbhouse.kafka.dispatch.api.task;

import org.apache.kafka.common.TopicPartition;

/**
 * Read-only view of the worker executing a task. It carries no mutable state, so a strategy may keep it after the
 * task has finished.
 */
public interface WorkerHandle {

    int workerId();

    String poolId();

    /**
     * @return id of the message stream (consumer thread slot) the worker's pool belongs to
     */
    String streamId();

    TopicPartition topicPartition();

}
