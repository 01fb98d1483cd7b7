package com.rtbhouse.kafka.dispatch.api.task;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/**
 * Outcome of a single {@link Task}. Exactly one result is delivered for every dispatched task.
 */
public final class TaskResult {

    public enum Status {
        SUCCESSFUL, PROCESSING_FAILED, TIMED_OUT
    }

    private final TaskId taskId;
    private final Status status;
    private final Exception cause;

    private TaskResult(TaskId taskId, Status status, @Nullable Exception cause) {
        this.taskId = checkNotNull(taskId);
        this.status = status;
        this.cause = cause;
    }

    public static TaskResult successful(TaskId taskId) {
        return new TaskResult(taskId, Status.SUCCESSFUL, null);
    }

    public static TaskResult processingFailed(TaskId taskId) {
        return new TaskResult(taskId, Status.PROCESSING_FAILED, null);
    }

    public static TaskResult processingFailed(TaskId taskId, Exception cause) {
        return new TaskResult(taskId, Status.PROCESSING_FAILED, cause);
    }

    public static TaskResult timedOut(TaskId taskId) {
        return new TaskResult(taskId, Status.TIMED_OUT, null);
    }

    public TaskId taskId() {
        return taskId;
    }

    public Status status() {
        return status;
    }

    public boolean isSuccessful() {
        return status == Status.SUCCESSFUL;
    }

    @Nullable
    public Exception cause() {
        return cause;
    }

    @Override
    public String toString() {
        return "TaskResult{" + taskId + ", " + status + (cause != null ? ", cause=" + cause : "") + "}";
    }
}
