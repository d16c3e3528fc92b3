package com.livepipe.realtime.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TimerService} backed by a Spring {@link TaskScheduler}.
 *
 * RealtimeConfig gives it a single-threaded ThreadPoolTaskScheduler, so every
 * timer callback of the engine and the transport client runs on the same
 * thread, one at a time.
 */
public class TaskSchedulerTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerTimerService.class);

    private final TaskScheduler scheduler;
    private final Clock         clock;

    public TaskSchedulerTimerService(TaskScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock     = clock;
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(guard(task), now().plus(delay));
        return new FutureHandle(future);
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                guard(task), now().plus(initialDelay), period);
        return new FutureHandle(future);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    // A throwing periodic task would otherwise be silently unscheduled.
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Timer task failed: {}", e.getMessage(), e);
            }
        };
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {
        @Override public void cancel()         { future.cancel(false); }
        @Override public boolean isCancelled() { return future.isCancelled(); }
    }
}
