package com.rtbhouse.kafka.dispatch.api.task;

import com.rtbhouse.kafka.dispatch.api.DispatchConfig;
import com.rtbhouse.kafka.dispatch.api.message.Message;

/**
 * User-defined logic which processes a single {@link Message}.
 * <p>
 * Implementations may be called concurrently by all workers of all pools, so they have to be thread-safe. A call
 * which does not return within {@link DispatchConfig#POOL_TASK_TIMEOUT_MS} is reported as
 * {@link TaskResult.Status#TIMED_OUT} and its late return value is discarded. A thrown exception is reported as
 * {@link TaskResult.Status#PROCESSING_FAILED}.
 */
@FunctionalInterface
public interface ProcessingStrategy<K, V> {

    /**
     * @param worker
     *            worker executing the task
     * @param message
     *            message to process
     * @param taskId
     *            id which has to be passed to the returned {@link TaskResult}
     * @return outcome of the processing
     */
    TaskResult process(WorkerHandle worker, Message<K, V> message, TaskId taskId);

}
