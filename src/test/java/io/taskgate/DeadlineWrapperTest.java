package io.taskgate;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadlineWrapperTest {

    private static ScheduledExecutorService clock;

    @BeforeAll
    static void startClock() {
        clock = Executors.newScheduledThreadPool(2);
    }

    @AfterAll
    static void stopClock() {
        clock.shutdownNow();
    }

    @Test
    void defaultsAreAsExpected() {
        DeadlineWrapper defaults = DeadlineWrapper.defaults();
        assertEquals(Duration.ofMillis(5000L), defaults.timeout());
        assertTrue(defaults.rejectOnTimeout());

        DeadlineWrapper lenient = DeadlineWrapper.of(Duration.ofMillis(10)).withRejectOnTimeout(false);
        assertFalse(lenient.rejectOnTimeout());
        assertEquals(Duration.ofMillis(10), lenient.timeout());

        assertThrows(IllegalArgumentException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                DeadlineWrapper.of(Duration.ofMillis(-1));
            }
        });
    }

    @Test
    void slowFunctionIsRejectedWithTimeoutExpired() throws Exception {
        AsyncTask<String> wrapped = DeadlineWrapper.of(Duration.ofMillis(50)).wrap("slowFn", completesAfter("done", 200L));
        final CompletableFuture<String> result = wrapped.start().toCompletableFuture();

        ExecutionException thrown = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                result.get(1L, TimeUnit.SECONDS);
            }
        });
        assertTrue(thrown.getCause() instanceof TimeoutExpiredException);
        TimeoutExpiredException timeout = (TimeoutExpiredException) thrown.getCause();
        assertEquals("slowFn", timeout.functionName());
        assertEquals(50L, timeout.timeoutMillis());
        assertEquals("Timeout-wrapped function slowFn took longer than 50ms to resolve", timeout.getMessage());
    }

    @Test
    void slowFunctionStaysUnsettledWhenRejectOnTimeoutIsOff() throws Exception {
        final AtomicBoolean finished = new AtomicBoolean();
        AsyncTask<String> slowFn = new AsyncTask<String>() {
            @Override
            public CompletionStage<String> start() {
                final CompletableFuture<String> inner = new CompletableFuture<String>();
                clock.schedule(new Runnable() {
                    @Override
                    public void run() {
                        finished.set(true);
                        inner.complete("done");
                    }
                }, 200L, TimeUnit.MILLISECONDS);
                return inner;
            }
        };
        CompletableFuture<String> result = DeadlineWrapper
            .withTimeout("slowFn", slowFn, Duration.ofMillis(50), false)
            .start()
            .toCompletableFuture();

        Thread.sleep(100L);
        assertFalse(result.isDone());

        Thread.sleep(250L);
        assertTrue(finished.get());
        assertFalse(result.isDone());
    }

    @Test
    void fastFunctionResolvesAndTimerIsReleased() throws Exception {
        ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(1);
        timers.setRemoveOnCancelPolicy(true);
        try {
            AsyncTask<Integer> wrapped = DeadlineWrapper.of(Duration.ofMillis(50))
                .withDelayScheduler(DelayScheduler.from(timers))
                .wrap("fastFn", completesAfter(42, 10L));
            CompletableFuture<Integer> result = wrapped.start().toCompletableFuture();

            assertEquals(Integer.valueOf(42), result.get(1L, TimeUnit.SECONDS));
            assertTrue(timers.getQueue().isEmpty());

            Thread.sleep(80L);
            assertFalse(result.isCompletedExceptionally());
            assertEquals(Integer.valueOf(42), result.join());
        } finally {
            timers.shutdownNow();
        }
    }

    @Test
    void failureBeforeDeadlineIsForwardedVerbatim() throws Exception {
        final IllegalStateException boom = new IllegalStateException("boom");
        AsyncTask<String> failing = new AsyncTask<String>() {
            @Override
            public CompletionStage<String> start() {
                final CompletableFuture<String> inner = new CompletableFuture<String>();
                clock.schedule(new Runnable() {
                    @Override
                    public void run() {
                        inner.completeExceptionally(boom);
                    }
                }, 5L, TimeUnit.MILLISECONDS);
                return inner;
            }
        };
        final CompletableFuture<String> result = DeadlineWrapper.of(Duration.ofMillis(500)).wrap(failing).start().toCompletableFuture();

        ExecutionException thrown = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                result.get(1L, TimeUnit.SECONDS);
            }
        });
        assertSame(boom, thrown.getCause());
    }

    @Test
    void ownExecutionExceptionIsForwardedUnchanged() throws Exception {
        final ExecutionException own = new ExecutionException("own", new IllegalStateException("inner"));
        AsyncTask<String> failing = new AsyncTask<String>() {
            @Override
            public CompletionStage<String> start() {
                final CompletableFuture<String> inner = new CompletableFuture<String>();
                clock.schedule(new Runnable() {
                    @Override
                    public void run() {
                        inner.completeExceptionally(own);
                    }
                }, 5L, TimeUnit.MILLISECONDS);
                return inner;
            }
        };
        final CompletableFuture<String> result = DeadlineWrapper.of(Duration.ofMillis(500)).wrap(failing).start().toCompletableFuture();

        ExecutionException thrown = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                result.get(1L, TimeUnit.SECONDS);
            }
        });
        assertSame(own, thrown.getCause());
    }

    @Test
    void synchronousThrowSettlesImmediatelyAndCancelsTimer() throws Exception {
        ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(1);
        timers.setRemoveOnCancelPolicy(true);
        try {
            AsyncTask<String> throwing = new AsyncTask<String>() {
                @Override
                public CompletionStage<String> start() throws Exception {
                    throw new java.io.IOException("no route");
                }
            };
            CompletableFuture<String> result = DeadlineWrapper.of(Duration.ofSeconds(5))
                .withDelayScheduler(DelayScheduler.from(timers))
                .wrap(throwing)
                .start()
                .toCompletableFuture();

            assertTrue(result.isCompletedExceptionally());
            assertTrue(timers.getQueue().isEmpty());
        } finally {
            timers.shutdownNow();
        }
    }

    @Test
    void lateResultAfterDeadlineIsDiscarded() throws Exception {
        final CompletableFuture<String> inner = new CompletableFuture<String>();
        AsyncTask<String> manual = new AsyncTask<String>() {
            @Override
            public CompletionStage<String> start() {
                return inner;
            }
        };
        final CompletableFuture<String> result = DeadlineWrapper.of(Duration.ofMillis(20)).wrap("manual", manual).start().toCompletableFuture();

        ExecutionException expired = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                result.get(1L, TimeUnit.SECONDS);
            }
        });
        assertTrue(expired.getCause() instanceof TimeoutExpiredException);

        inner.complete("too late");
        assertTrue(result.isCompletedExceptionally());
    }

    @Test
    void eachInvocationRacesIndependently() throws Exception {
        final AtomicInteger calls = new AtomicInteger();
        AsyncFunction<Long, Long> sleepy = new AsyncFunction<Long, Long>() {
            @Override
            public CompletionStage<Long> apply(final Long millis) {
                calls.incrementAndGet();
                final CompletableFuture<Long> inner = new CompletableFuture<Long>();
                clock.schedule(new Runnable() {
                    @Override
                    public void run() {
                        inner.complete(millis);
                    }
                }, millis, TimeUnit.MILLISECONDS);
                return inner;
            }
        };
        AsyncFunction<Long, Long> wrapped = DeadlineWrapper.of(Duration.ofMillis(60)).wrap("sleepy", sleepy);

        CompletableFuture<Long> fast = wrapped.apply(5L).toCompletableFuture();
        final CompletableFuture<Long> slow = wrapped.apply(300L).toCompletableFuture();

        assertEquals(Long.valueOf(5L), fast.get(1L, TimeUnit.SECONDS));
        ExecutionException expired = assertThrows(ExecutionException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() throws Throwable {
                slow.get(1L, TimeUnit.SECONDS);
            }
        });
        assertTrue(expired.getCause() instanceof TimeoutExpiredException);
        assertEquals("sleepy", ((TimeoutExpiredException) expired.getCause()).functionName());
        assertEquals(2, calls.get());
    }

    @Test
    void functionNameFallsBackToClassOrAnonymousMarker() {
        AsyncTask<String> lambda = () -> CompletableFuture.completedFuture("x");
        AsyncTask<String> anonymous = new AsyncTask<String>() {
            @Override
            public CompletionStage<String> start() {
                return CompletableFuture.completedFuture("y");
            }
        };

        assertEquals(DeadlineWrapper.ANONYMOUS, DeadlineWrapper.describe(null, lambda));
        assertEquals(DeadlineWrapper.ANONYMOUS, DeadlineWrapper.describe("  ", anonymous));
        assertEquals("FetchProfile", DeadlineWrapper.describe(null, new FetchProfile()));
        assertEquals("explicit", DeadlineWrapper.describe("explicit", new FetchProfile()));
    }

    @Test
    void wrappedTaskComposesWithQueue() {
        BoundedQueue queue = BoundedQueue.create(2);
        DeadlineWrapper deadline = DeadlineWrapper.of(Duration.ofMillis(40));

        final Task<String> slow = queue.push("slow", deadline.wrap("slowFn", completesAfter("late", 300L)));
        Task<String> fast = queue.push("fast", deadline.wrap("fastFn", completesAfter("quick", 5L)));

        AwaitTimeoutException gaveUp = assertThrows(AwaitTimeoutException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                slow.await(Duration.ofMillis(1));
            }
        });
        assertEquals("slow", gaveUp.taskName());

        assertEquals("quick", fast.await(Duration.ofSeconds(1)));
        TimeoutExpiredException timeout = assertThrows(TimeoutExpiredException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                slow.await(Duration.ofSeconds(1));
            }
        });
        assertEquals("slowFn", timeout.functionName());
        assertTrue(slow.isFailed());
    }

    private static <T> AsyncTask<T> completesAfter(final T value, final long millis) {
        return new AsyncTask<T>() {
            @Override
            public CompletionStage<T> start() {
                final CompletableFuture<T> inner = new CompletableFuture<T>();
                clock.schedule(new Runnable() {
                    @Override
                    public void run() {
                        inner.complete(value);
                    }
                }, millis, TimeUnit.MILLISECONDS);
                return inner;
            }
        };
    }

    private static final class FetchProfile implements AsyncTask<String> {
        @Override
        public CompletionStage<String> start() {
            return CompletableFuture.completedFuture("profile");
        }
    }
}
