package io.taskgate;

import io.taskgate.internal.QueueMetrics;
import io.taskgate.internal.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * 有界并发任务队列。
 *
 * <p>{@code BoundedQueue} 接收异步任务，按提交顺序（FIFO）启动，同一时刻最多运行
 * {@link #concurrencyLimit()} 个任务；每次提交立即返回一个 {@link Task} 句柄，
 * 任务结束时句柄被结算且只结算一次。某个任务失败只影响它自己的句柄。
 *
 * <p>调度时机：每次 {@code push} 之后、每个任务结算之后各触发一次调度。
 * 调度过程通过 work-in-progress 计数串行化：调度进行中再次触发（无论来自同步完成的任务
 * 还是其他线程）只会让当前这一轮多循环一次，调度逻辑不会与自身并发，也不会递归压栈。
 *
 * <p>线程安全约束：
 * 配置方法（{@code with*}）只能在第一次提交前调用；
 * {@code push}/{@code clear}/{@code running} 支持并发调用。
 *
 * <p>示例：
 * <pre>{@code
 * BoundedQueue queue = BoundedQueue.create(4);
 * Task<Page> page = queue.push("fetch-1", () -> http.getAsync(url));
 * page.thenApply(Page::title);
 * }</pre>
 */
public final class BoundedQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedQueue.class);

    private static final int DEFAULT_CONCURRENCY_LIMIT = 2;
    private static final AtomicLong QUEUE_IDS = new AtomicLong(1L);

    private final int concurrencyLimit;
    private final AtomicLong taskIdGen;
    private final AtomicBoolean configLocked;
    private final AtomicBoolean closed;
    private final AtomicInteger wip;
    private final AtomicReference<QueueInvariantError> broken;
    private final QueueMetrics metrics;

    private final Object lock;
    private final Deque<Task<?>> pending;
    private final Set<Task<?>> running;
    private final Map<Long, Binding<?>> bindings;

    private volatile String name;
    private volatile QueueHook hook;
    private volatile Scheduler scheduler;

    private BoundedQueue(int concurrencyLimit) {
        if (concurrencyLimit <= 0) {
            throw new IllegalArgumentException("concurrencyLimit must be > 0");
        }
        this.concurrencyLimit = concurrencyLimit;
        this.taskIdGen = new AtomicLong(1L);
        this.configLocked = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
        this.wip = new AtomicInteger(0);
        this.broken = new AtomicReference<QueueInvariantError>();
        this.metrics = new QueueMetrics();
        this.lock = new Object();
        this.pending = new ArrayDeque<Task<?>>();
        this.running = new LinkedHashSet<Task<?>>();
        this.bindings = new HashMap<Long, Binding<?>>();
        this.name = "queue-" + QUEUE_IDS.getAndIncrement();
        this.hook = QueueHooks.noop();
        this.scheduler = Scheduler.commonPool();
    }

    /**
     * 创建并发上限为 2 的队列。
     */
    public static BoundedQueue create() {
        return new BoundedQueue(DEFAULT_CONCURRENCY_LIMIT);
    }

    /**
     * 创建指定并发上限的队列，上限必须 {@code >= 1}。
     */
    public static BoundedQueue create(int concurrencyLimit) {
        return new BoundedQueue(concurrencyLimit);
    }

    /**
     * 设置队列名称（出现在 {@link TaskInfo} 和日志中）。
     */
    public BoundedQueue withName(String name) {
        Objects.requireNonNull(name, "name");
        ensureConfigurable();
        this.name = name;
        return this;
    }

    /**
     * 设置任务生命周期回调。
     *
     * <p>内置指标始终可用；hook 适合桥接外部日志、指标、Tracing 系统。
     */
    public BoundedQueue withHook(QueueHook hook) {
        Objects.requireNonNull(hook, "hook");
        ensureConfigurable();
        this.hook = hook;
        return this;
    }

    /**
     * 指定 {@link #pushBlocking(Callable)} 使用的执行器。
     */
    public BoundedQueue withScheduler(Scheduler scheduler) {
        Objects.requireNonNull(scheduler, "scheduler");
        ensureConfigurable();
        this.scheduler = scheduler;
        return this;
    }

    public int concurrencyLimit() {
        return concurrencyLimit;
    }

    public String name() {
        return name;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * 获取内置运行时指标快照。
     */
    public QueueMetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * 提交匿名任务，任务名自动生成为 {@code task-<id>}。
     */
    public <T> Task<T> push(AsyncTask<T> task) {
        long id = taskIdGen.getAndIncrement();
        return push("task-" + id, task, id);
    }

    /**
     * 提交具名任务。
     *
     * <p>任务被追加到等待队列尾部并立即触发一次调度；本方法不会阻塞等待名额。
     * 同一个 {@link AsyncTask} 实例可以重复提交，每次都是独立的任务。
     */
    public <T> Task<T> push(String name, AsyncTask<T> task) {
        return push(name, task, taskIdGen.getAndIncrement());
    }

    /**
     * 提交同步（可能阻塞）任务，在 {@link #scheduler()} 的执行器上运行。
     */
    public <T> Task<T> pushBlocking(Callable<T> callable) {
        long id = taskIdGen.getAndIncrement();
        return push("task-" + id, blocking(callable), id);
    }

    /**
     * 提交具名同步任务。
     */
    public <T> Task<T> pushBlocking(String name, Callable<T> callable) {
        return push(name, blocking(callable), taskIdGen.getAndIncrement());
    }

    /**
     * 清空等待中的任务。
     *
     * <p>正在运行的任务不受影响，照常结束并结算。被清掉的任务永远不会启动，
     * 它们的句柄也永远不会结算（状态变为 {@link Task.State#DISCARDED}）。
     */
    public void clear() {
        List<Binding<?>> dropped = new ArrayList<Binding<?>>();
        synchronized (lock) {
            for (Task<?> task : pending) {
                task.markDiscarded();
                Binding<?> binding = bindings.remove(task.id());
                if (binding != null) {
                    dropped.add(binding);
                }
            }
            pending.clear();
        }
        if (dropped.isEmpty()) {
            return;
        }
        metrics.recordDiscarded(dropped.size());
        log.debug("[{}] cleared {} pending task(s)", name, dropped.size());
        for (Binding<?> binding : dropped) {
            safeHookDiscard(binding.info);
        }
    }

    /**
     * 当前正在运行的任务快照；修改返回值不会影响队列。
     */
    public Set<Task<?>> running() {
        synchronized (lock) {
            return new LinkedHashSet<Task<?>>(running);
        }
    }

    /**
     * 等待中的任务快照，按启动顺序排列。
     */
    public List<Task<?>> pending() {
        synchronized (lock) {
            return new ArrayList<Task<?>>(pending);
        }
    }

    /**
     * 关闭队列：拒绝后续提交，丢弃等待中的任务，并关闭队列持有的执行器。
     *
     * <p>正在运行的任务继续运行直至结算。该方法幂等。
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        clear();
        scheduler.shutdownIfOwned();
        log.debug("[{}] closed", name);
    }

    /**
     * 丢弃某个等待中任务的结果绑定，用于模拟簿记损坏（包级，仅测试使用）。
     */
    boolean forgetBinding(Task<?> task) {
        synchronized (lock) {
            return bindings.remove(task.id()) != null;
        }
    }

    private <T> Task<T> push(String name, AsyncTask<T> body, long id) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "task");
        ensureHealthy();
        ensureOpen();
        configLocked.set(true);

        CompletableFuture<T> future = new CompletableFuture<T>();
        Task<T> task = new Task<T>(id, name, future);
        Binding<T> binding = new Binding<T>(task, body, new TaskInfo(this.name, id, name, Instant.now()));
        int queued;
        synchronized (lock) {
            bindings.put(id, binding);
            pending.addLast(task);
            queued = pending.size();
        }
        metrics.recordPush();
        log.debug("[{}] pushed {} (pending={})", this.name, name, queued);

        drain();
        return task;
    }

    /**
     * 调度循环：名额未满且有等待任务时，取队头启动，直到名额占满或队列为空。
     */
    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        while (true) {
            Binding<?> next;
            while ((next = admitNext()) != null) {
                start(next);
            }
            missed = wip.addAndGet(-missed);
            if (missed == 0) {
                return;
            }
        }
    }

    private Binding<?> admitNext() {
        synchronized (lock) {
            if (running.size() >= concurrencyLimit || pending.isEmpty()) {
                return null;
            }
            Task<?> task = pending.pollFirst();
            Binding<?> binding = bindings.get(task.id());
            if (binding == null) {
                throw invariantBroken("Missing result binding for queue task " + task.name() + " (#" + task.id() + ")");
            }
            running.add(task);
            task.markRunning();
            metrics.recordStart(running.size());
            return binding;
        }
    }

    private <T> void start(final Binding<T> binding) {
        binding.startedAtNanos = System.nanoTime();
        safeHookStart(binding.info);

        CompletionStage<T> stage;
        try {
            stage = binding.body.start();
            if (stage == null) {
                stage = Stages.<T>failed(new NullPointerException("Task " + binding.info.name() + " returned no completion stage"));
            }
        } catch (Throwable throwable) {
            stage = Stages.<T>failed(throwable);
        }

        stage.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                try {
                    settle(binding, value, error);
                } catch (QueueInvariantError invariantError) {
                    Thread current = Thread.currentThread();
                    current.getUncaughtExceptionHandler().uncaughtException(current, invariantError);
                    throw invariantError;
                }
            }
        });
    }

    /**
     * 结算：移出运行集合并释放绑定（同一把锁内），随后写入句柄，再通知 hook，最后触发下一轮调度。
     */
    private <T> void settle(Binding<T> binding, T value, Throwable error) {
        Task<T> task = binding.task;
        synchronized (lock) {
            running.remove(task);
            bindings.remove(task.id());
        }
        long elapsed = Math.max(0L, System.nanoTime() - binding.startedAtNanos);

        if (error == null) {
            task.markSuccess();
            metrics.recordTerminal(Task.State.SUCCESS, elapsed);
            log.debug("[{}] {} succeeded in {} ms", name, task.name(), elapsed / 1_000_000L);
            task.promise().complete(value);
            safeHookSuccess(binding.info, elapsed);
        } else {
            Throwable cause = Stages.unwrap(error);
            task.markFailed();
            metrics.recordTerminal(Task.State.FAILED, elapsed);
            log.debug("[{}] {} failed in {} ms: {}", name, task.name(), elapsed / 1_000_000L, cause.toString());
            task.promise().completeExceptionally(cause);
            safeHookFailure(binding.info, cause, elapsed);
        }

        drain();
    }

    private <T> AsyncTask<T> blocking(final Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        return new AsyncTask<T>() {
            @Override
            public CompletionStage<T> start() {
                final CompletableFuture<T> result = new CompletableFuture<T>();
                Executor executor = scheduler.executor();
                executor.execute(new Runnable() {
                    @Override
                    public void run() {
                        try {
                            result.complete(callable.call());
                        } catch (Throwable throwable) {
                            result.completeExceptionally(throwable);
                        }
                    }
                });
                return result;
            }
        };
    }

    private QueueInvariantError invariantBroken(String message) {
        QueueInvariantError error = new QueueInvariantError("[" + name + "] " + message);
        broken.compareAndSet(null, error);
        log.error("[{}] queue bookkeeping is inconsistent, refusing further work", name, error);
        return error;
    }

    private void ensureHealthy() {
        QueueInvariantError error = broken.get();
        if (error != null) {
            throw error;
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("BoundedQueue " + name + " already closed");
        }
    }

    private void ensureConfigurable() {
        ensureOpen();
        if (configLocked.get()) {
            throw new IllegalStateException("BoundedQueue configuration is locked after first push");
        }
    }

    private void safeHookStart(TaskInfo info) {
        try {
            hook.onStart(info);
        } catch (Throwable e) {
            hookFailed("onStart", info, e);
        }
    }

    private void safeHookSuccess(TaskInfo info, long durationNanos) {
        try {
            hook.onSuccess(info, Duration.ofNanos(durationNanos));
        } catch (Throwable e) {
            hookFailed("onSuccess", info, e);
        }
    }

    private void safeHookFailure(TaskInfo info, Throwable error, long durationNanos) {
        try {
            hook.onFailure(info, error, Duration.ofNanos(durationNanos));
        } catch (Throwable e) {
            hookFailed("onFailure", info, e);
        }
    }

    private void safeHookDiscard(TaskInfo info) {
        try {
            hook.onDiscard(info);
        } catch (Throwable e) {
            hookFailed("onDiscard", info, e);
        }
    }

    /**
     * hook 异常不影响调度，只计数并告警。
     */
    private void hookFailed(String event, TaskInfo info, Throwable failure) {
        metrics.recordHookFailure();
        log.warn("[{}] hook {} failed for {}", name, event, info, failure);
    }

    /**
     * 任务 ID 到结果写入端的绑定，push 时登记，结算或被 clear 丢弃时移除。
     */
    private static final class Binding<T> {

        private final Task<T> task;
        private final AsyncTask<T> body;
        private final TaskInfo info;
        private volatile long startedAtNanos;

        private Binding(Task<T> task, AsyncTask<T> body, TaskInfo info) {
            this.task = task;
            this.body = body;
            this.info = info;
        }
    }
}
