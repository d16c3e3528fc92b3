package com.livepipe.realtime.scheduling;

/**
 * Handle to a task scheduled on a {@link TimerService}.
 */
public interface TimerHandle {

    /** Cancel the task. Has no effect if it already ran or was cancelled. */
    void cancel();

    boolean isCancelled();
}
