package io.taskgate;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncBatchTest {

    private static final AsyncFunction<Integer, Boolean> IS_EVEN = new AsyncFunction<Integer, Boolean>() {
        @Override
        public CompletionStage<Boolean> apply(Integer value) {
            return CompletableFuture.supplyAsync(new java.util.function.Supplier<Boolean>() {
                @Override
                public Boolean get() {
                    return value % 2 == 0;
                }
            });
        }
    };

    @Test
    void everyReducesAnswersToSingleBoolean() throws Exception {
        assertTrue(AsyncBatch.every(Arrays.asList(2, 4, 6), IS_EVEN).get(1L, TimeUnit.SECONDS));
        assertFalse(AsyncBatch.every(Arrays.asList(2, 3, 6), IS_EVEN).get(1L, TimeUnit.SECONDS));
        assertTrue(AsyncBatch.every(Collections.<Integer>emptyList(), IS_EVEN).get(1L, TimeUnit.SECONDS));
    }

    @Test
    void filterKeepsAcceptedElementsInInputOrder() throws Exception {
        List<Integer> kept = AsyncBatch.filter(Arrays.asList(5, 4, 3, 2, 1, 0), IS_EVEN).get(1L, TimeUnit.SECONDS);
        assertEquals(Arrays.asList(4, 2, 0), kept);
        assertTrue(AsyncBatch.filter(Collections.<Integer>emptyList(), IS_EVEN).get(1L, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void predicateIsStartedForEveryElementBeforeAnyAnswer() {
        final AtomicInteger started = new AtomicInteger();
        final List<CompletableFuture<Boolean>> answers = new ArrayList<CompletableFuture<Boolean>>();
        AsyncFunction<String, Boolean> manual = new AsyncFunction<String, Boolean>() {
            @Override
            public CompletionStage<Boolean> apply(String value) {
                started.incrementAndGet();
                CompletableFuture<Boolean> answer = new CompletableFuture<Boolean>();
                answers.add(answer);
                return answer;
            }
        };

        CompletableFuture<List<String>> result = AsyncBatch.filter(Arrays.asList("a", "b", "c"), manual);
        assertEquals(3, started.get());
        assertFalse(result.isDone());

        answers.get(2).complete(true);
        answers.get(0).complete(false);
        answers.get(1).complete(true);
        assertEquals(Arrays.asList("b", "c"), result.join());
    }

    @Test
    void failingPredicateFailsTheWholeBatch() {
        final IllegalStateException boom = new IllegalStateException("boom");
        AsyncFunction<Integer, Boolean> failsOnThree = new AsyncFunction<Integer, Boolean>() {
            @Override
            public CompletionStage<Boolean> apply(Integer value) {
                if (value == 3) {
                    throw boom;
                }
                return CompletableFuture.completedFuture(Boolean.TRUE);
            }
        };

        final CompletableFuture<Boolean> result = AsyncBatch.every(Arrays.asList(1, 2, 3, 4), failsOnThree);
        ExecutionException thrown = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                result.get(1L, TimeUnit.SECONDS);
            }
        });
        assertSame(boom, thrown.getCause());
    }
}
