package io.taskgate;

import java.time.Duration;

/**
 * Immutable queue-level task runtime metrics snapshot.
 */
public final class QueueMetricsSnapshot {

    private final long pushed;
    private final long started;
    private final long succeeded;
    private final long failed;
    private final long discarded;
    private final long hookFailures;
    private final long peakRunning;
    private final long totalDurationNanos;
    private final long maxDurationNanos;

    public QueueMetricsSnapshot(
        long pushed,
        long started,
        long succeeded,
        long failed,
        long discarded,
        long hookFailures,
        long peakRunning,
        long totalDurationNanos,
        long maxDurationNanos
    ) {
        this.pushed = pushed;
        this.started = started;
        this.succeeded = succeeded;
        this.failed = failed;
        this.discarded = discarded;
        this.hookFailures = hookFailures;
        this.peakRunning = peakRunning;
        this.totalDurationNanos = totalDurationNanos;
        this.maxDurationNanos = maxDurationNanos;
    }

    public long pushed() {
        return pushed;
    }

    public long started() {
        return started;
    }

    public long succeeded() {
        return succeeded;
    }

    public long failed() {
        return failed;
    }

    public long discarded() {
        return discarded;
    }

    public long hookFailures() {
        return hookFailures;
    }

    /**
     * Highest number of simultaneously running tasks observed so far.
     */
    public long peakRunning() {
        return peakRunning;
    }

    public long completed() {
        return succeeded + failed;
    }

    public Duration totalDuration() {
        return Duration.ofNanos(totalDurationNanos);
    }

    public Duration averageDuration() {
        long completed = completed();
        if (completed == 0L) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalDurationNanos / completed);
    }

    public Duration maxDuration() {
        return Duration.ofNanos(maxDurationNanos);
    }

    @Override
    public String toString() {
        Duration avg = averageDuration();
        Duration max = maxDuration();

        StringBuilder sb = new StringBuilder(256);
        sb.append("QueueMetricsSnapshot{\n");
        sb.append("  pushed=").append(pushed).append(",\n");
        sb.append("  started=").append(started).append(",\n");
        sb.append("  succeeded=").append(succeeded).append(",\n");
        sb.append("  failed=").append(failed).append(",\n");
        sb.append("  discarded=").append(discarded).append(",\n");
        sb.append("  hookFailures=").append(hookFailures).append(",\n");
        sb.append("  peakRunning=").append(peakRunning).append(",\n");
        sb.append("  averageDuration=").append(avg).append(" (").append(avg.toMillis()).append(" ms),\n");
        sb.append("  maxDuration=").append(max).append(" (").append(max.toMillis()).append(" ms)\n");
        sb.append("}");
        return sb.toString();
    }
}
