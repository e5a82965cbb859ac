package io.taskgate;

/**
 * Raised by {@link Task#await(java.time.Duration)} when the handle has not settled in time.
 *
 * <p>Only the wait is abandoned; the task keeps its slot and settles on its own schedule.
 */
public class AwaitTimeoutException extends RuntimeException {

    private final String taskName;
    private final long timeoutMillis;

    public AwaitTimeoutException(String taskName, long timeoutMillis, Throwable cause) {
        super("Task " + taskName + " did not settle within " + timeoutMillis + "ms", cause);
        this.taskName = taskName;
        this.timeoutMillis = timeoutMillis;
    }

    public String taskName() {
        return taskName;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }
}
