package io.taskgate;

/**
 * Raised when a thread waiting on a task handle is interrupted or the handle was cancelled.
 */
public class CancelledException extends RuntimeException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
