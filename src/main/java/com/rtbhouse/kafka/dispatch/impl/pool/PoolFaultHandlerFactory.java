package com.rtbhouse.kafka.dispatch.impl.pool;

import com.rtbhouse.kafka.dispatch.api.pool.PoolFaultAction;
import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.stream.StreamsManager;

public final class PoolFaultHandlerFactory {

    private PoolFaultHandlerFactory() {
    }

    public static PoolFaultHandler create(
            PoolFaultAction action,
            DispatchConsumerImpl<?, ?> consumer,
            StreamsManager<?, ?> streamsManager) {
        switch (action) {
            case SHUTDOWN_CONSUMER:
                return new ShutdownConsumerFaultHandler(consumer);
            case STOP_PARTITION:
                return new StopPartitionFaultHandler(streamsManager);
            default:
                throw new IllegalStateException(String.format("Pool fault action [%s] not supported", action.name()));
        }
    }
}
