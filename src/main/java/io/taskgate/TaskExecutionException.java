package io.taskgate;

/**
 * Raised when awaiting a task whose execution failed with a checked exception.
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
