package io.taskgate;

import java.util.concurrent.CompletionStage;

/**
 * A one-argument asynchronous function.
 */
public interface AsyncFunction<A, R> {

    CompletionStage<R> apply(A argument) throws Exception;
}
