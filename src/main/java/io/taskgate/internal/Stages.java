package io.taskgate.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Small helpers around {@link CompletableFuture} that are missing from the Java 8 API.
 */
public final class Stages {

    private Stages() {
    }

    public static <T> CompletableFuture<T> failed(Throwable throwable) {
        CompletableFuture<T> failed = new CompletableFuture<T>();
        failed.completeExceptionally(throwable);
        return failed;
    }

    /**
     * Strips the single {@link CompletionException} layer a dependent stage adds; the task's own error is kept as is.
     */
    public static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
