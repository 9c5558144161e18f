package com.bringabrain.link.ble.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task (connection timeouts, scan windows,
 * paced fragment writes, stale-buffer sweeps).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();

    /**
     * Handle for work that was never scheduled.
     */
    Cancellable NONE = () -> false;
}
