package io.taskgate.internal;

import io.taskgate.QueueMetricsSnapshot;
import io.taskgate.Task;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Low-overhead task metrics recorder for one queue.
 */
public final class QueueMetrics {

    private final LongAdder pushed;
    private final LongAdder started;
    private final LongAdder succeeded;
    private final LongAdder failed;
    private final LongAdder discarded;
    private final LongAdder hookFailures;
    private final LongAdder totalDurationNanos;
    private final AtomicLong maxDurationNanos;
    private final AtomicLong peakRunning;

    public QueueMetrics() {
        this.pushed = new LongAdder();
        this.started = new LongAdder();
        this.succeeded = new LongAdder();
        this.failed = new LongAdder();
        this.discarded = new LongAdder();
        this.hookFailures = new LongAdder();
        this.totalDurationNanos = new LongAdder();
        this.maxDurationNanos = new AtomicLong(0L);
        this.peakRunning = new AtomicLong(0L);
    }

    public void recordPush() {
        pushed.increment();
    }

    public void recordStart(int runningNow) {
        started.increment();
        updateMax(peakRunning, runningNow);
    }

    public void recordTerminal(Task.State state, long durationNanos) {
        long safeDuration = Math.max(0L, durationNanos);
        totalDurationNanos.add(safeDuration);
        updateMax(maxDurationNanos, safeDuration);

        if (state == Task.State.SUCCESS) {
            succeeded.increment();
        } else if (state == Task.State.FAILED) {
            failed.increment();
        }
    }

    public void recordDiscarded(int count) {
        discarded.add(count);
    }

    public void recordHookFailure() {
        hookFailures.increment();
    }

    public QueueMetricsSnapshot snapshot() {
        return new QueueMetricsSnapshot(
            pushed.sum(),
            started.sum(),
            succeeded.sum(),
            failed.sum(),
            discarded.sum(),
            hookFailures.sum(),
            peakRunning.get(),
            totalDurationNanos.sum(),
            maxDurationNanos.get()
        );
    }

    private static void updateMax(AtomicLong target, long candidate) {
        long current = target.get();
        while (candidate > current) {
            if (target.compareAndSet(current, candidate)) {
                return;
            }
            current = target.get();
        }
    }
}
