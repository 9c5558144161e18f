package com.bringabrain.link.ble.internal.exec;

import com.bringabrain.link.ble.internal.time.Cancellable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Objects;

/**
 * FragmentPump
 * =============================================================================
 * Paced, cancellable emission of encoded fragments on one link.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Values are written strictly in enqueue order, so the fragments of one
 *       packet leave in index order.</li>
 *   <li>After each successful write the next one is scheduled
 *       {@code interFragmentDelay} later on the owning {@link SerialContext}.
 *       The context is never blocked while waiting.</li>
 *   <li>If the platform refuses a write (outgoing queue full) the same value is
 *       retried after {@code busyRetryDelay}, or at once on {@link #onReady()}.
 *       Values are never skipped.</li>
 *   <li>{@link #close()} drops everything not yet written. Fragments already
 *       on the air cannot be recalled; the receiver discards the partial
 *       packet by timeout or on disconnect.</li>
 * </ul>
 *
 * <p>The delay is a throttle for the local radio buffer. Reassembly does not
 * depend on it.</p>
 *
 * <h2>Threading</h2>
 * <p>All methods must be called on the owning context.</p>
 */
public final class FragmentPump
{
    /**
     * Writes one channel value.
     */
    @FunctionalInterface
    public interface ValueWriter
    {
        /**
         * @return {@code false} if the platform cannot take the value right now
         */
        boolean write(byte[] value);
    }

    private final SerialContext context;
    private final ValueWriter writer;
    private final Duration interFragmentDelay;
    private final Duration busyRetryDelay;

    private final Deque<byte[]> queue = new ArrayDeque<>();
    private Cancellable scheduled = Cancellable.NONE;
    private boolean armed;
    private boolean blocked;
    private boolean closed;
    private long written;

    public FragmentPump(SerialContext context,
                        ValueWriter writer,
                        Duration interFragmentDelay,
                        Duration busyRetryDelay)
    {
        this.context = Objects.requireNonNull(context, "context");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.interFragmentDelay = Objects.requireNonNull(interFragmentDelay, "interFragmentDelay");
        this.busyRetryDelay = Objects.requireNonNull(busyRetryDelay, "busyRetryDelay");
    }

    /**
     * Append values to the outgoing queue and start emitting if idle.
     */
    public void enqueue(Collection<byte[]> values)
    {
        if (closed) {
            return;
        }
        queue.addAll(values);
        if (!armed) {
            pump();
        }
    }

    /**
     * The platform signalled room in its outgoing queue.
     */
    public void onReady()
    {
        if (closed || !blocked) {
            return;
        }
        scheduled.cancel();
        pump();
    }

    /**
     * Stop emitting and drop all queued values.
     *
     * @return number of values dropped
     */
    public int close()
    {
        closed = true;
        scheduled.cancel();
        scheduled = Cancellable.NONE;
        armed = false;
        int dropped = queue.size();
        queue.clear();
        return dropped;
    }

    public int pendingCount()
    {
        return queue.size();
    }

    public long writtenCount()
    {
        return written;
    }

    public boolean isClosed()
    {
        return closed;
    }

    private void pump()
    {
        armed = false;
        blocked = false;
        if (closed) {
            return;
        }

        byte[] next = queue.peekFirst();
        if (next == null) {
            return;
        }

        if (!writer.write(next)) {
            blocked = true;
            arm(busyRetryDelay);
            return;
        }

        queue.pollFirst();
        written++;

        if (!queue.isEmpty()) {
            arm(interFragmentDelay);
        }
    }

    private void arm(Duration delay)
    {
        armed = true;
        scheduled = context.schedule(delay, this::pump);
    }
}
