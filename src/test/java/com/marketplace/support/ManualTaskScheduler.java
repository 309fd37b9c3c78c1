package com.marketplace.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

/**
 * Deterministic {@link TaskScheduler} for tests: time only moves when {@link #advance} is
 * called, and due tasks run on the calling thread in due-time order.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final List<ManualFuture> tasks = new ArrayList<>();
    private long sequence;

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime, sequence++);
        tasks.add(future);
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Triggers are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("Periodic tasks are not supported");
    }

    /**
     * Moves time forward, running every task that falls due on the way, including tasks
     * scheduled by the tasks themselves.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<ManualFuture> next = tasks.stream()
                    .filter(ManualFuture::isPending)
                    .filter(f -> !f.dueAt.isAfter(target))
                    .min(Comparator.comparing((ManualFuture f) -> f.dueAt).thenComparingLong(f -> f.sequence));
            if (next.isEmpty()) {
                break;
            }
            ManualFuture future = next.get();
            if (future.dueAt.isAfter(clock.instant())) {
                clock.set(future.dueAt);
            }
            future.run();
        }
        clock.set(target);
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public long nowMillis() {
        return clock.millis();
    }

    /** Tasks neither run nor cancelled. */
    public int pendingCount() {
        return (int) tasks.stream().filter(ManualFuture::isPending).count();
    }

    /** Due instants of the pending tasks, in millis relative to now. */
    public List<Long> pendingDelaysMillis() {
        long now = clock.millis();
        return tasks.stream()
                .filter(ManualFuture::isPending)
                .map(f -> f.dueAt.toEpochMilli() - now)
                .sorted()
                .toList();
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Instant dueAt;
        private final long sequence;
        private boolean cancelled;
        private boolean done;

        private ManualFuture(Runnable task, Instant dueAt, long sequence) {
            this.task = task;
            this.dueAt = dueAt;
            this.sequence = sequence;
        }

        private boolean isPending() {
            return !cancelled && !done;
        }

        private void run() {
            done = true;
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAt.toEpochMilli() - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done || cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        private void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
