package io.taskgate;

import java.time.Duration;

/**
 * Hook composition helpers.
 */
public final class QueueHooks {

    private static final QueueHook NOOP = new QueueHook() {
    };

    private QueueHooks() {
    }

    /**
     * Hook that ignores every event.
     */
    public static QueueHook noop() {
        return NOOP;
    }

    /**
     * Combines two hooks. Both are always invoked; if either throws, the first failure is rethrown
     * after the second hook ran, with any later failure attached as suppressed.
     */
    public static QueueHook compose(final QueueHook left, final QueueHook right) {
        if (left == NOOP) {
            return right;
        }
        if (right == NOOP) {
            return left;
        }
        return new QueueHook() {
            @Override
            public void onStart(final TaskInfo info) {
                invokeBoth(new Event() {
                    @Override
                    public void fire(QueueHook hook) {
                        hook.onStart(info);
                    }
                });
            }

            @Override
            public void onSuccess(final TaskInfo info, final Duration duration) {
                invokeBoth(new Event() {
                    @Override
                    public void fire(QueueHook hook) {
                        hook.onSuccess(info, duration);
                    }
                });
            }

            @Override
            public void onFailure(final TaskInfo info, final Throwable error, final Duration duration) {
                invokeBoth(new Event() {
                    @Override
                    public void fire(QueueHook hook) {
                        hook.onFailure(info, error, duration);
                    }
                });
            }

            @Override
            public void onDiscard(final TaskInfo info) {
                invokeBoth(new Event() {
                    @Override
                    public void fire(QueueHook hook) {
                        hook.onDiscard(info);
                    }
                });
            }

            private void invokeBoth(Event event) {
                RuntimeException primary = null;
                try {
                    event.fire(left);
                } catch (RuntimeException e) {
                    primary = e;
                }
                try {
                    event.fire(right);
                } catch (RuntimeException e) {
                    if (primary == null) {
                        primary = e;
                    } else {
                        primary.addSuppressed(e);
                    }
                }
                if (primary != null) {
                    throw primary;
                }
            }
        };
    }

    private interface Event {
        void fire(QueueHook hook);
    }
}
