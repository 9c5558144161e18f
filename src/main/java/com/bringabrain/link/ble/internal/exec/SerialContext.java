package com.bringabrain.link.ble.internal.exec;

import com.bringabrain.link.ble.internal.time.Cancellable;
import com.bringabrain.link.ble.internal.time.MonotonicClock;
import com.bringabrain.link.ble.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * SerialContext
 * =============================================================================
 * The single serialized execution context owned by one connection manager.
 *
 * <h2>Role</h2>
 * <p>Platform callbacks and engine calls arrive on arbitrary threads. A manager
 * never mutates its radio state, peer registry, or reassembly buffers from
 * those threads; it submits a task here, and this context runs tasks one at a
 * time in submission order. This is the single-consumer event channel between
 * the platform and the manager's state.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Tasks never run concurrently with each other</li>
 *   <li>Tasks submitted from one thread run in submission order</li>
 *   <li>Scheduled tasks run on the same context, at or after their deadline</li>
 *   <li>A task that throws does not stop the context</li>
 * </ul>
 */
public interface SerialContext extends Executor, MonotonicScheduler
{
    /**
     * Enqueue a task.
     */
    @Override
    void execute(Runnable task);

    /**
     * Clock that deadlines on this context are measured against.
     */
    MonotonicClock clock();

    /**
     * True if the calling thread is this context's thread.
     */
    boolean inContext();

    /**
     * Schedule {@code task} after {@code delay} on this context.
     */
    default Cancellable schedule(Duration delay, Runnable task)
    {
        return scheduleAfter(delay, clock(), task);
    }

    /**
     * Stop accepting tasks. Tasks already queued still run.
     */
    void shutdown();
}
