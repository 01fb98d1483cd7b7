package com.rtbhouse.kafka.dispatch.impl.worker;

import org.apache.kafka.common.TopicPartition;

import com.rtbhouse.kafka.dispatch.api.task.WorkerHandle;

public final class DefaultWorkerHandle implements WorkerHandle {

    private final int workerId;
    private final String poolId;
    private final String streamId;
    private final TopicPartition topicPartition;

    public DefaultWorkerHandle(int workerId, String poolId, String streamId, TopicPartition topicPartition) {
        this.workerId = workerId;
        this.poolId = poolId;
        this.streamId = streamId;
        this.topicPartition = topicPartition;
    }

    @Override
    public int workerId() {
        return workerId;
    }

    @Override
    public String poolId() {
        return poolId;
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    public TopicPartition topicPartition() {
        return topicPartition;
    }

    @Override
    public String toString() {
        return poolId + "-worker-" + workerId;
    }
}
