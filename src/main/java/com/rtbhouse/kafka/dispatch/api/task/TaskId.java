package com.rtbhouse.kafka.dispatch.api.task;

/**
 * Identifies a single dispatch of a message to a worker. Retries of the same message get new ids.
 */
public final class TaskId {

    private final long sequence;

    private TaskId(long sequence) {
        this.sequence = sequence;
    }

    public static TaskId of(long sequence) {
        return new TaskId(sequence);
    }

    public long sequence() {
        return sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskId)) {
            return false;
        }
        return sequence == ((TaskId) o).sequence;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return "task-" + sequence;
    }
}
