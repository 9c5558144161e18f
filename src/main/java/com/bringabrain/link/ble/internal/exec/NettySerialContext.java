package com.bringabrain.link.ble.internal.exec;

import com.bringabrain.link.ble.internal.time.Cancellable;
import com.bringabrain.link.ble.internal.time.MonotonicClock;
import com.bringabrain.link.ble.internal.time.SystemMonotonicClock;
import com.bringabrain.link.ble.internal.time.WallClock;
import com.bringabrain.link.ble.observability.TransportErrorEvent;
import com.bringabrain.link.ble.observability.TransportObservabilitySink;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * NettySerialContext
 * =============================================================================
 * Production {@link SerialContext} backed by a single-threaded Netty
 * {@link DefaultEventExecutor}.
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty types MUST NOT escape this class. Callers see only
 * {@link SerialContext} and {@link Cancellable}.</p>
 *
 * <h2>Failure handling</h2>
 * <p>A task that throws is reported to the observability sink and the loop
 * continues with the next task. A task submitted after {@link #shutdown()}
 * is rejected and reported; it does not run.</p>
 *
 * <h2>Clock</h2>
 * <p>Netty schedules on {@link System#nanoTime()}, so this context always
 * uses {@link SystemMonotonicClock}.</p>
 */
public final class NettySerialContext implements SerialContext
{
    private final EventExecutor executor;
    private final TransportObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public NettySerialContext(String threadName,
                              TransportObservabilitySink observabilitySink,
                              WallClock wallClock)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.executor = new DefaultEventExecutor(new DefaultThreadFactory(threadName, true));
    }

    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new TransportErrorEvent(wallClock.now(), "Task rejected after shutdown", e));
        }
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock().nowNanos());
        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(guarded(task), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            observabilitySink.onError(new TransportErrorEvent(wallClock.now(), "Scheduled task rejected after shutdown", e));
            return Cancellable.NONE;
        }
        return () -> future.cancel(false);
    }

    @Override
    public MonotonicClock clock()
    {
        return SystemMonotonicClock.INSTANCE;
    }

    @Override
    public boolean inContext()
    {
        return executor.inEventLoop();
    }

    @Override
    public void shutdown()
    {
        executor.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /**
     * Wait for the loop thread to finish after {@link #shutdown()}.
     *
     * @return {@code true} if it terminated within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException
    {
        return executor.awaitTermination(timeout, unit);
    }

    private Runnable guarded(Runnable task)
    {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                observabilitySink.onError(new TransportErrorEvent(wallClock.now(), "Task failed on serial context", e));
            }
        };
    }
}
