package io.taskgate;

/**
 * Outcome of a {@link DeadlineWrapper}-wrapped function whose deadline elapsed before it settled.
 *
 * <p>The function itself is not cancelled; its late result is discarded.
 */
public class TimeoutExpiredException extends RuntimeException {

    private final String functionName;
    private final long timeoutMillis;

    public TimeoutExpiredException(String functionName, long timeoutMillis) {
        super("Timeout-wrapped function " + functionName + " took longer than " + timeoutMillis + "ms to resolve");
        this.functionName = functionName;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Name of the wrapped function, or {@code <anonymous>}.
     */
    public String functionName() {
        return functionName;
    }

    public long timeoutMillis() {
        return timeoutMillis;
    }
}
