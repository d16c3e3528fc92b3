package com.livepipe.realtime.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * The cooperative scheduler both the transport client and the pipeline
 * engine run their timers on.
 *
 * Production code uses {@link TaskSchedulerTimerService} (one scheduler
 * thread). Tests substitute a virtual-time implementation so backoff,
 * timeouts and progress ticks can be advanced deterministically.
 */
public interface TimerService {

    /** Run {@code task} once after {@code delay}. */
    TimerHandle schedule(Runnable task, Duration delay);

    /** Run {@code task} every {@code period}, first after {@code initialDelay}. */
    TimerHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /** Current time as seen by this scheduler. */
    Instant now();

    /** Cancel {@code handle} if it is non-null. */
    static void cancel(TimerHandle handle) {
        if (handle != null) {
            handle.cancel();
        }
    }
}
