package io.taskgate;

import io.taskgate.internal.Stages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Applies an asynchronous predicate to every element of a fixed list at once and reduces the answers.
 *
 * <p>All predicate calls are started before any answer is awaited; there is no concurrency limit.
 * Push the calls through a {@link BoundedQueue} when one is needed.
 */
public final class AsyncBatch {

    private AsyncBatch() {
    }

    /**
     * Completes with {@code true} iff the predicate holds for every element; an empty list yields {@code true}.
     * Fails with the error of the earliest failing element in list order.
     */
    public static <T> CompletableFuture<Boolean> every(List<T> items, AsyncFunction<? super T, Boolean> predicate) {
        return evaluate(items, predicate).thenApply(new Function<List<Boolean>, Boolean>() {
            @Override
            public Boolean apply(List<Boolean> answers) {
                for (Boolean answer : answers) {
                    if (!Boolean.TRUE.equals(answer)) {
                        return Boolean.FALSE;
                    }
                }
                return Boolean.TRUE;
            }
        });
    }

    /**
     * Completes with the elements the predicate accepted, in input order.
     */
    public static <T> CompletableFuture<List<T>> filter(final List<T> items, AsyncFunction<? super T, Boolean> predicate) {
        return evaluate(items, predicate).thenApply(new Function<List<Boolean>, List<T>>() {
            @Override
            public List<T> apply(List<Boolean> answers) {
                List<T> kept = new ArrayList<T>();
                for (int i = 0; i < answers.size(); i++) {
                    if (Boolean.TRUE.equals(answers.get(i))) {
                        kept.add(items.get(i));
                    }
                }
                return Collections.unmodifiableList(kept);
            }
        });
    }

    private static <T> CompletableFuture<List<Boolean>> evaluate(List<T> items, AsyncFunction<? super T, Boolean> predicate) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(predicate, "predicate");

        final List<CompletableFuture<Boolean>> answers = new ArrayList<CompletableFuture<Boolean>>(items.size());
        for (T item : items) {
            answers.add(invoke(predicate, item));
        }

        final CompletableFuture<List<Boolean>> all = new CompletableFuture<List<Boolean>>();
        CompletableFuture.allOf(answers.toArray(new CompletableFuture<?>[0])).whenComplete(
            new BiConsumer<Void, Throwable>() {
                @Override
                public void accept(Void ignored, Throwable error) {
                    if (error != null) {
                        all.completeExceptionally(Stages.unwrap(firstFailure(answers, error)));
                        return;
                    }
                    List<Boolean> values = new ArrayList<Boolean>(answers.size());
                    for (CompletableFuture<Boolean> answer : answers) {
                        values.add(answer.join());
                    }
                    all.complete(values);
                }
            }
        );
        return all;
    }

    private static <T> CompletableFuture<Boolean> invoke(AsyncFunction<? super T, Boolean> predicate, T item) {
        try {
            CompletionStage<Boolean> stage = predicate.apply(item);
            if (stage == null) {
                return Stages.failed(new NullPointerException("predicate returned no completion stage"));
            }
            return stage.toCompletableFuture();
        } catch (Throwable throwable) {
            return Stages.failed(throwable);
        }
    }

    /**
     * The failure of the earliest element in list order, so the reported error does not depend on timing.
     */
    private static Throwable firstFailure(List<CompletableFuture<Boolean>> answers, Throwable fallback) {
        for (CompletableFuture<Boolean> answer : answers) {
            if (answer.isCompletedExceptionally()) {
                try {
                    answer.join();
                } catch (RuntimeException e) {
                    return e;
                }
            }
        }
        return fallback;
    }
}
