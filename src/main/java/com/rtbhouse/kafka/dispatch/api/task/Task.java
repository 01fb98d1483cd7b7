package com.rtbhouse.kafka.dispatch.api.task;

import static com.google.common.base.Preconditions.checkNotNull;

import com.rtbhouse.kafka.dispatch.api.message.Message;

public final class Task<K, V> {

    private final TaskId id;
    private final Message<K, V> message;

    public Task(TaskId id, Message<K, V> message) {
        this.id = checkNotNull(id);
        this.message = checkNotNull(message);
    }

    public TaskId id() {
        return id;
    }

    public Message<K, V> message() {
        return message;
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", message=" + message + "}";
    }
}
