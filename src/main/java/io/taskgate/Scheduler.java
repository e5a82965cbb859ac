package io.taskgate;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 阻塞任务的执行器来源。
 *
 * <p>{@link BoundedQueue#pushBlocking(java.util.concurrent.Callable)} 提交的同步任务
 * 会在这里的执行器上运行；并发上限仍由队列控制，执行器只负责提供线程。
 *
 * <p>该类型为线程安全且不可变对象。
 */
public final class Scheduler {

    private static final Scheduler COMMON_POOL = new Scheduler(ForkJoinPool.commonPool(), false, "commonPool");

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final String name;

    private Scheduler(ExecutorService executor, boolean ownsExecutor, String name) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.name = name;
    }

    /**
     * 返回公共 ForkJoin 调度器包装（默认值）。
     *
     * <p>该调度器不会随队列关闭。
     */
    public static Scheduler commonPool() {
        return COMMON_POOL;
    }

    /**
     * 创建固定大小线程池调度器，队列关闭时一并关闭。
     *
     * <p>线程数通常取队列并发上限即可：
     * <pre>{@code
     * BoundedQueue queue = BoundedQueue.create(4).withScheduler(Scheduler.fixed(4));
     * }</pre>
     */
    public static Scheduler fixed(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            size,
            size,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            new NamedThreadFactory("taskgate-fixed")
        );
        executor.allowCoreThreadTimeOut(true);
        return new Scheduler(executor, true, "fixed(" + size + ")");
    }

    /**
     * 基于外部执行器创建调度器包装，生命周期由调用方管理。
     */
    public static Scheduler from(ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        return new Scheduler(executor, false, "external");
    }

    /**
     * 调度器名称（用于日志）。
     */
    public String name() {
        return name;
    }

    ExecutorService executor() {
        return executor;
    }

    void shutdownIfOwned() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger id;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
            this.id = new AtomicInteger(1);
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + id.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
