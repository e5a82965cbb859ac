package io.taskgate;

/**
 * Handle for a pending deadline timer.
 */
public interface ScheduledTask {

    /**
     * Cancels the timer if it has not fired yet.
     *
     * @return true when this call prevented the timer from firing.
     */
    boolean cancel();

    boolean isCancelled();

    /**
     * @return true when the timer has fired or has been cancelled.
     */
    boolean isDone();
}
