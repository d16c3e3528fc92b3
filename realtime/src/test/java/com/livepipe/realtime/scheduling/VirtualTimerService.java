package com.livepipe.realtime.scheduling;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * {@link TimerService} on a virtual clock. Nothing runs until the test calls
 * {@link #advance}; tasks then run on the calling thread in due order, ties
 * broken by scheduling order.
 */
public class VirtualTimerService implements TimerService {

    private final PriorityQueue<Task> queue = new PriorityQueue<>(
            Comparator.comparing((Task t) -> t.due).thenComparingLong(t -> t.seq));

    private Instant now;
    private long    seq;

    public VirtualTimerService() {
        this(Instant.parse("2024-01-20T10:00:00Z"));
    }

    public VirtualTimerService(Instant start) {
        this.now = start;
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        return enqueue(new Task(task, now.plus(delay), null));
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        return enqueue(new Task(task, now.plus(initialDelay), period));
    }

    @Override
    public Instant now() {
        return now;
    }

    /** Run everything due within {@code duration}, then set the clock to its end. */
    public void advance(Duration duration) {
        Instant target = now.plus(duration);
        while (!queue.isEmpty() && !queue.peek().due.isAfter(target)) {
            Task next = queue.poll();
            if (next.cancelled) {
                continue;
            }
            now = next.due;
            if (next.period != null) {
                next.due = next.due.plus(next.period);
                enqueue(next);
            }
            next.runnable.run();
        }
        now = target;
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /** Scheduled tasks that have not been cancelled. */
    public long pendingCount() {
        return queue.stream().filter(t -> !t.cancelled).count();
    }

    private Task enqueue(Task task) {
        task.seq = seq++;
        queue.add(task);
        return task;
    }

    private static final class Task implements TimerHandle {

        final Runnable runnable;
        final Duration period;
        Instant  due;
        long     seq;
        boolean  cancelled;

        Task(Runnable runnable, Instant due, Duration period) {
            this.runnable = runnable;
            this.due      = due;
            this.period   = period;
        }

        @Override public void cancel()         { cancelled = true; }
        @Override public boolean isCancelled() { return cancelled; }
    }
}
