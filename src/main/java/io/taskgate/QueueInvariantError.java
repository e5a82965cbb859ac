package io.taskgate;

/**
 * Signals broken bookkeeping inside a {@link BoundedQueue}, e.g. a dequeued task with no recorded result binding.
 *
 * <p>This is never a user-facing condition. Once raised the queue refuses further pushes.
 */
public class QueueInvariantError extends Error {

    public QueueInvariantError(String message) {
        super(message);
    }
}
