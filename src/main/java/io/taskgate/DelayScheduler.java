package io.taskgate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 截止时间计时器。
 *
 * <p>{@link DeadlineWrapper} 每次调用都会在这里登记一个一次性计时器，
 * 被包装函数先结算时立即取消。进程级共享实例在多个包装器之间是线程安全的。
 */
public final class DelayScheduler {

    private static final DelayScheduler SHARED = new DelayScheduler(createSharedExecutor());

    private final ScheduledExecutorService executor;

    private DelayScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * 获取进程级共享调度器实例（单个守护线程，取消即移除）。
     */
    public static DelayScheduler shared() {
        return SHARED;
    }

    /**
     * 基于外部 {@link ScheduledExecutorService} 构造包装，生命周期由调用方负责。
     */
    public static DelayScheduler from(ScheduledExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new DelayScheduler(executor);
    }

    /**
     * 提交一次性延迟动作。
     */
    public ScheduledTask schedule(Duration delay, Runnable runnable) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(runnable, "runnable");
        ScheduledFuture<?> future = executor.schedule(runnable, delay.toMillis(), TimeUnit.MILLISECONDS);
        return new DefaultScheduledTask(future);
    }

    private static ScheduledExecutorService createSharedExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
            private final AtomicInteger id = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "taskgate-deadline-" + id.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    private static final class DefaultScheduledTask implements ScheduledTask {

        private final ScheduledFuture<?> future;

        private DefaultScheduledTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }

        @Override
        public boolean isDone() {
            return future.isDone();
        }
    }
}
