package io.taskgate;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * 队列中单个任务的结果句柄。
 *
 * <p>{@code Task} 由 {@link BoundedQueue#push(AsyncTask)} 在提交时创建，
 * 身份以句柄为准：同一个 {@link AsyncTask} 实例提交两次会得到两个互不相关的句柄。
 * 句柄内部的 {@link CompletableFuture} 只会被队列结算一次。
 *
 * <p>示例：
 * <pre>{@code
 * Task<String> t = queue.push("load-user", () -> client.fetchUser(id));
 * String user = t.await();
 * }</pre>
 */
public final class Task<T> {

    /**
     * 任务生命周期状态。
     */
    public enum State {
        /** 已入队，尚未开始。 */
        PENDING,
        /** 已占用并发名额，正在执行。 */
        RUNNING,
        /** 成功完成。 */
        SUCCESS,
        /** 失败完成。 */
        FAILED,
        /** 被 {@link BoundedQueue#clear()} 丢弃，句柄永远不会结算。 */
        DISCARDED
    }

    private final long id;
    private final String name;
    private final CompletableFuture<T> future;
    private final AtomicReference<State> state;

    /**
     * 包级构造函数，仅供 {@link BoundedQueue} 创建任务句柄。
     */
    Task(long id, String name, CompletableFuture<T> future) {
        this.id = id;
        this.name = name;
        this.future = future;
        this.state = new AtomicReference<State>(State.PENDING);
    }

    /**
     * 任务 ID（在同一个队列内单调递增）。
     */
    public long id() {
        return id;
    }

    /**
     * 任务名称。
     */
    public String name() {
        return name;
    }

    /**
     * 获取当前任务状态快照。
     */
    public State state() {
        return state.get();
    }

    /**
     * 句柄是否已经结算（成功或失败）。丢弃的任务永远返回 {@code false}。
     */
    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 任务是否处于失败状态。
     */
    public boolean isFailed() {
        return state.get() == State.FAILED;
    }

    /**
     * 任务是否已被 {@link BoundedQueue#clear()} 丢弃。
     */
    public boolean isDiscarded() {
        return state.get() == State.DISCARDED;
    }

    /**
     * 等待任务结算并返回结果。
     *
     * <p>异常语义：
     * 任务抛出的运行时异常/错误原样传播；
     * checked exception 包装为 {@link TaskExecutionException}；
     * 等待线程被中断时抛 {@link CancelledException}。
     *
     * <p>注意：对已丢弃的任务调用本方法会永久阻塞，请改用 {@link #await(Duration)}。
     */
    public T await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while awaiting task " + name, e);
        } catch (CancellationException e) {
            throw new CancelledException("Task " + name + " was cancelled", e);
        } catch (ExecutionException e) {
            rethrow(e.getCause());
            return null;
        }
    }

    /**
     * 在指定时间内等待任务结算。
     *
     * <p>超时抛 {@link AwaitTimeoutException}，只代表“停止等待”，任务本身不受影响；
     * 它与截止时间包装器的 {@link TimeoutExpiredException} 无关。
     */
    public T await(Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while awaiting task " + name, e);
        } catch (CancellationException e) {
            throw new CancelledException("Task " + name + " was cancelled", e);
        } catch (ExecutionException e) {
            rethrow(e.getCause());
            return null;
        } catch (TimeoutException e) {
            throw new AwaitTimeoutException(name, timeout.toMillis(), e);
        }
    }

    /**
     * 暴露底层 {@link CompletableFuture}，用于与外部 API 互操作。
     *
     * <p>返回的是只读视图：对其调用 complete/cancel 不会影响队列内的结算。
     */
    public CompletableFuture<T> toCompletableFuture() {
        return future.thenApply(Function.<T>identity());
    }

    /**
     * 任务成功后做同步映射。
     */
    public <U> CompletableFuture<U> thenApply(Function<? super T, ? extends U> function) {
        return future.thenApply(function);
    }

    /**
     * 任务成功后做异步映射。
     */
    public <U> CompletableFuture<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> function) {
        return future.thenCompose(function);
    }

    /**
     * 任务异常完成时提供兜底值映射。
     */
    public CompletableFuture<T> exceptionally(Function<Throwable, ? extends T> function) {
        return future.exceptionally(function);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", name='" + name + "', state=" + state.get() + "}";
    }

    /**
     * 结算写入端（包级，仅队列调用）。
     */
    CompletableFuture<T> promise() {
        return future;
    }

    boolean markRunning() {
        return state.compareAndSet(State.PENDING, State.RUNNING);
    }

    void markSuccess() {
        state.set(State.SUCCESS);
    }

    void markFailed() {
        state.set(State.FAILED);
    }

    boolean markDiscarded() {
        return state.compareAndSet(State.PENDING, State.DISCARDED);
    }

    /**
     * 统一异常转换并重新抛出。
     */
    private void rethrow(Throwable cause) {
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new TaskExecutionException("Task " + name + " failed", cause);
    }
}
