package com.rtbhouse.kafka.dispatch.impl.pool;

import com.rtbhouse.kafka.dispatch.impl.errors.PoolFaultException;

/**
 * Decides what happens to the consumer when one of its pools is faulted. Called from the faulted pool's own thread,
 * after the pool has stopped dispatching.
 */
public interface PoolFaultHandler {

    void onPoolFault(WorkerPool<?, ?> pool, PoolFaultException exception);

}
