package io.taskgate;

import java.time.Instant;

/**
 * Immutable metadata for a pushed task.
 */
public final class TaskInfo {

    private final String queueName;
    private final long taskId;
    private final String name;
    private final Instant createdAt;

    public TaskInfo(String queueName, long taskId, String name, Instant createdAt) {
        this.queueName = queueName;
        this.taskId = taskId;
        this.name = name;
        this.createdAt = createdAt;
    }

    public String queueName() {
        return queueName;
    }

    public long taskId() {
        return taskId;
    }

    public String name() {
        return name;
    }

    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return queueName + "/" + name + "#" + taskId;
    }
}
