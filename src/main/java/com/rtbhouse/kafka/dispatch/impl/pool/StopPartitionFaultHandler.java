package com.rtbhouse.kafka.dispatch.impl.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;
import com.rtbhouse.kafka.dispatch.impl.stream.StreamsManager;

public class StopPartitionFaultHandler implements PoolFaultHandler {

    private static final Logger logger = LoggerFactory.getLogger(StopPartitionFaultHandler.class);

    private final StreamsManager<?, ?> streamsManager;

    public StopPartitionFaultHandler(StreamsManager<?, ?> streamsManager) {
        this.streamsManager = streamsManager;
    }

    @Override
    public void onPoolFault(WorkerPool<?, ?> pool, PoolFaultException exception) {
        logger.warn("partition {} will be stopped and paused until the next rebalance", pool.partition());
        // the pool is stopped by the consumer thread, which owns the offset storage
        streamsManager.markFaulted(pool.partition());
    }
}
