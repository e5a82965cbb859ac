package io.taskgate;

import java.time.Duration;

/**
 * Observability callbacks for task lifecycle events inside a {@link BoundedQueue}.
 * Callbacks run on the thread that drives scheduling; implementations should return quickly.
 */
public interface QueueHook {

    default void onStart(TaskInfo info) {
    }

    default void onSuccess(TaskInfo info, Duration duration) {
    }

    default void onFailure(TaskInfo info, Throwable error, Duration duration) {
    }

    /**
     * Called for each pending task dropped by {@link BoundedQueue#clear()}.
     */
    default void onDiscard(TaskInfo info) {
    }
}
