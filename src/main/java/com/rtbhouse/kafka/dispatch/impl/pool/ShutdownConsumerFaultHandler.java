package com.rtbhouse.kafka.dispatch.impl.pool;

import com.rtbhouse.kafka.dispatch.impl.DispatchConsumerImpl;
import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;

public class ShutdownConsumerFaultHandler implements PoolFaultHandler {

    private final DispatchConsumerImpl<?, ?> consumer;

    public ShutdownConsumerFaultHandler(DispatchConsumerImpl<?, ?> consumer) {
        this.consumer = consumer;
    }

    @Override
    public void onPoolFault(WorkerPool<?, ?> pool, PoolFaultException exception) {
        consumer.shutdown(exception);
    }
}
