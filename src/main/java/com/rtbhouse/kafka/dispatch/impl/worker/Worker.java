package com.rtbhouse.kafka.dispatch.impl.worker;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rtbhouse.kafka.dispatch.api.DispatchException;
import com.rtbhouse.kafka.dispatch.api.task.ProcessingStrategy;
import com.rtbhouse.kafka.dispatch.api.task.Task;
import com.rtbhouse.kafka.dispatch.api.task.TaskId;
import com.rtbhouse.kafka.dispatch.api.task.TaskResult;
import com.rtbhouse.kafka.dispatch.api.task.WorkerHandle;
import com.rtbhouse.kafka.dispatch.impl.errors.BadStatusException;

/**
 * Executes one task at a time under a deadline. Every {@link #start(Task, ProcessingStrategy)} call delivers exactly
 * one {@link TaskResult} to the output queue: the strategy's result if it returns in time, otherwise
 * {@link TaskResult.Status#TIMED_OUT}. A strategy returning after the deadline has its result discarded.
 * <p>
 * The worker never returns itself to any availability pool, its owner decides when it can be reused (see
 * {@link #whenIdle()}).
 */
public class Worker<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final WorkerHandle handle;
    private final Queue<TaskResult> outputQueue;
    private final Duration taskTimeout;
    private final Executor executor;

    private volatile CompletableFuture<Void> execution = CompletableFuture.completedFuture(null);

    public Worker(WorkerHandle handle, Queue<TaskResult> outputQueue, Duration taskTimeout, Executor executor) {
        this.handle = handle;
        this.outputQueue = outputQueue;
        this.taskTimeout = taskTimeout;
        this.executor = executor;
    }

    public synchronized void start(Task<K, V> task, ProcessingStrategy<K, V> strategy) {
        if (!execution.isDone()) {
            throw new BadStatusException("worker " + handle + " is still executing previous task, cannot start " + task);
        }
        TaskId taskId = task.id();
        // single assignment slot: the first of strategy result and timeout wins, the other is dropped
        CompletableFuture<TaskResult> result = new CompletableFuture<>();
        try {
            execution = CompletableFuture.runAsync(() -> result.complete(execute(task, strategy)), executor);
        } catch (RejectedExecutionException e) {
            execution = CompletableFuture.completedFuture(null);
            result.complete(TaskResult.processingFailed(taskId, e));
        }
        result.completeOnTimeout(TaskResult.timedOut(taskId), taskTimeout.toMillis(), MILLISECONDS)
                .thenAccept(taskResult -> deliver(task, taskResult));
    }

    private TaskResult execute(Task<K, V> task, ProcessingStrategy<K, V> strategy) {
        TaskId taskId = task.id();
        try {
            TaskResult taskResult = strategy.process(handle, task.message(), taskId);
            if (taskResult == null) {
                return TaskResult.processingFailed(taskId, new DispatchException("strategy returned no result for " + task));
            }
            if (!taskId.equals(taskResult.taskId())) {
                return TaskResult.processingFailed(taskId, new DispatchException(
                        "strategy returned result of " + taskResult.taskId() + " for " + task));
            }
            return taskResult;
        } catch (Exception e) {
            return TaskResult.processingFailed(taskId, e);
        } catch (Throwable e) {
            logger.error("{} failed with error processing {}", handle, task.message(), e);
            return TaskResult.processingFailed(taskId, new DispatchException("strategy failed with error for " + task, e));
        }
    }

    private void deliver(Task<K, V> task, TaskResult taskResult) {
        if (taskResult.status() == TaskResult.Status.TIMED_OUT) {
            logger.warn("{} timed out after {} ms processing {}", handle, taskTimeout.toMillis(), task.message());
        }
        outputQueue.add(taskResult);
    }

    /**
     * @return future completed when the current (possibly already timed out) execution has really finished
     */
    public CompletableFuture<Void> whenIdle() {
        return execution.handle((ignored, e) -> null);
    }

    public boolean isBusy() {
        return !execution.isDone();
    }

    public WorkerHandle handle() {
        return handle;
    }

    @Override
    public String toString() {
        return handle.toString();
    }
}
