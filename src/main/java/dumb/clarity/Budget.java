package dumb.clarity;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Step, wall-clock and cancellation limits for one half of an analysis. Search loops call {@link #tick()}
 * per node; when any limit is hit it throws {@link Exhausted}, which the component converts into an
 * {@code Unknown} or degraded result. Not thread-safe: one instance per worker.
 */
public final class Budget {
    private static final int CLOCK_CHECK_INTERVAL = 256;

    private final long stepLimit;
    private final long deadlineNanos;
    private final Cancellation cancellation;
    private long steps;

    public Budget(long stepLimit, long timeoutMillis, Cancellation cancellation) {
        this.stepLimit = stepLimit <= 0 ? Long.MAX_VALUE : stepLimit;
        this.deadlineNanos = timeoutMillis <= 0 ? Long.MAX_VALUE : System.nanoTime() + timeoutMillis * 1_000_000L;
        this.cancellation = cancellation;
    }

    public static Budget unlimited() {
        return new Budget(0, 0, new Cancellation());
    }

    public void tick() {
        if (++steps > stepLimit) throw new Exhausted(false, "step limit of " + stepLimit + " reached");
        if (steps % CLOCK_CHECK_INTERVAL == 0) check();
    }

    public void check() {
        if (cancellation.isCancelled()) throw new Exhausted(true, "cancelled");
        if (deadlineNanos != Long.MAX_VALUE && System.nanoTime() > deadlineNanos)
            throw new Exhausted(false, "time limit reached");
    }

    public long steps() {
        return steps;
    }

    public static final class Cancellation {
        private final AtomicBoolean cancelled = new AtomicBoolean();

        public void cancel() {
            cancelled.set(true);
        }

        public boolean isCancelled() {
            return cancelled.get();
        }
    }

    public static final class Exhausted extends RuntimeException {
        public final boolean cancelled;

        Exhausted(boolean cancelled, String message) {
            super(message, null, false, false);
            this.cancelled = cancelled;
        }
    }
}
