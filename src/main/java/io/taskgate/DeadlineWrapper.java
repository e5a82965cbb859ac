package io.taskgate;

import io.taskgate.internal.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * 给异步函数加上截止时间。
 *
 * <p>每次调用被包装的函数时：先登记一个计时器，再调用原函数，两者竞争结算外层结果，
 * 先到者通过同一个 settle-once 标志赢得结算权，后到者被丢弃。
 * 超时只代表“停止等待”，原函数不会被取消，仍会在后台跑完。
 *
 * <p>超时后的行为由 {@link #withRejectOnTimeout(boolean)} 决定：
 * {@code true}（默认）以 {@link TimeoutExpiredException} 失败；
 * {@code false} 则让外层结果永远保持未结算。
 *
 * <p>实例不可变，可在多处复用；每次调用都有独立的计时器和竞争状态。
 *
 * <p>示例：
 * <pre>{@code
 * AsyncTask<Report> guarded = DeadlineWrapper.of(Duration.ofMillis(300))
 *     .wrap("loadReport", () -> client.loadReport());
 * queue.push(guarded);
 * }</pre>
 */
public final class DeadlineWrapper {

    private static final Logger log = LoggerFactory.getLogger(DeadlineWrapper.class);

    static final String ANONYMOUS = "<anonymous>";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000L);
    private static final DeadlineWrapper DEFAULTS = new DeadlineWrapper(DEFAULT_TIMEOUT, true, DelayScheduler.shared());

    private final Duration timeout;
    private final boolean rejectOnTimeout;
    private final DelayScheduler delayScheduler;

    private DeadlineWrapper(Duration timeout, boolean rejectOnTimeout, DelayScheduler delayScheduler) {
        this.timeout = timeout;
        this.rejectOnTimeout = rejectOnTimeout;
        this.delayScheduler = delayScheduler;
    }

    /**
     * 默认配置：5000 ms，超时即失败，使用共享计时器。
     */
    public static DeadlineWrapper defaults() {
        return DEFAULTS;
    }

    /**
     * 指定超时时长，其余沿用默认配置。
     */
    public static DeadlineWrapper of(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        return new DeadlineWrapper(timeout, true, DelayScheduler.shared());
    }

    /**
     * 一次性包装的快捷方式。
     */
    public static <T> AsyncTask<T> withTimeout(String name, AsyncTask<T> func, Duration timeout, boolean rejectOnTimeout) {
        return of(timeout).withRejectOnTimeout(rejectOnTimeout).wrap(name, func);
    }

    public DeadlineWrapper withRejectOnTimeout(boolean rejectOnTimeout) {
        return new DeadlineWrapper(timeout, rejectOnTimeout, delayScheduler);
    }

    /**
     * 使用指定计时器（例如测试中的独立执行器）。
     */
    public DeadlineWrapper withDelayScheduler(DelayScheduler delayScheduler) {
        Objects.requireNonNull(delayScheduler, "delayScheduler");
        return new DeadlineWrapper(timeout, rejectOnTimeout, delayScheduler);
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean rejectOnTimeout() {
        return rejectOnTimeout;
    }

    /**
     * 包装无参异步任务，名称从实现类推断。
     */
    public <T> AsyncTask<T> wrap(AsyncTask<T> func) {
        return wrap(null, func);
    }

    /**
     * 包装无参异步任务；{@code name} 会出现在超时异常中。
     */
    public <T> AsyncTask<T> wrap(String name, final AsyncTask<T> func) {
        Objects.requireNonNull(func, "func");
        final String functionName = describe(name, func);
        return new AsyncTask<T>() {
            @Override
            public CompletionStage<T> start() {
                return race(functionName, new Invocation<T>() {
                    @Override
                    public CompletionStage<T> invoke() throws Exception {
                        return func.start();
                    }
                });
            }
        };
    }

    /**
     * 包装单参数异步函数，名称从实现类推断。
     */
    public <A, R> AsyncFunction<A, R> wrap(AsyncFunction<A, R> func) {
        return wrap(null, func);
    }

    /**
     * 包装单参数异步函数；{@code name} 会出现在超时异常中。
     */
    public <A, R> AsyncFunction<A, R> wrap(String name, final AsyncFunction<A, R> func) {
        Objects.requireNonNull(func, "func");
        final String functionName = describe(name, func);
        return new AsyncFunction<A, R>() {
            @Override
            public CompletionStage<R> apply(final A argument) {
                return race(functionName, new Invocation<R>() {
                    @Override
                    public CompletionStage<R> invoke() throws Exception {
                        return func.apply(argument);
                    }
                });
            }
        };
    }

    private <T> CompletableFuture<T> race(final String functionName, Invocation<T> invocation) {
        final CompletableFuture<T> outer = new CompletableFuture<T>();
        final AtomicBoolean settled = new AtomicBoolean(false);

        final ScheduledTask timer = delayScheduler.schedule(timeout, new Runnable() {
            @Override
            public void run() {
                if (!settled.compareAndSet(false, true)) {
                    return;
                }
                log.debug("{} exceeded {} ms, rejectOnTimeout={}", functionName, timeout.toMillis(), rejectOnTimeout);
                if (rejectOnTimeout) {
                    outer.completeExceptionally(new TimeoutExpiredException(functionName, timeout.toMillis()));
                }
            }
        });

        CompletionStage<T> stage;
        try {
            stage = invocation.invoke();
            if (stage == null) {
                stage = Stages.failed(new NullPointerException(functionName + " returned no completion stage"));
            }
        } catch (Throwable throwable) {
            stage = Stages.failed(throwable);
        }

        stage.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                timer.cancel();
                if (!settled.compareAndSet(false, true)) {
                    log.debug("{} settled after its deadline, result discarded", functionName);
                    return;
                }
                if (error == null) {
                    outer.complete(value);
                } else {
                    outer.completeExceptionally(Stages.unwrap(error));
                }
            }
        });
        return outer;
    }

    /**
     * 解析用于诊断的函数名：显式名称优先，其次具名实现类的简单类名，lambda 与匿名类记为 {@code <anonymous>}。
     */
    static String describe(String name, Object func) {
        if (name != null && !name.trim().isEmpty()) {
            return name;
        }
        Class<?> type = func.getClass();
        String simpleName = type.getSimpleName();
        if (type.isAnonymousClass() || type.isSynthetic() || simpleName.isEmpty() || simpleName.contains("$$Lambda")) {
            return ANONYMOUS;
        }
        return simpleName;
    }

    private interface Invocation<T> {
        CompletionStage<T> invoke() throws Exception;
    }
}
