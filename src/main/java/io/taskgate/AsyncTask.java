package io.taskgate;

import java.util.concurrent.CompletionStage;

/**
 * A zero-argument unit of asynchronous work.
 *
 * <p>{@link #start()} should return promptly with a stage that settles later.
 * Blocking work belongs in {@link BoundedQueue#pushBlocking(java.util.concurrent.Callable)}.
 */
public interface AsyncTask<T> {

    CompletionStage<T> start() throws Exception;
}
