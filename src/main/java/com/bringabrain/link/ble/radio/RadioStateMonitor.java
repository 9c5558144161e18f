package com.bringabrain.link.ble.radio;

import com.bringabrain.link.ble.internal.time.WallClock;
import com.bringabrain.link.ble.observability.RadioTransitionEvent;
import com.bringabrain.link.ble.observability.TransportObservabilitySink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * RadioStateMonitor
 * =============================================================================
 * Tracks the local radio state and gates radio operations on it.
 *
 * <h2>Pending operation slot</h2>
 * <p>The monitor holds at most one pending operation. A request issued while
 * the radio is not {@link RadioState#POWERED_ON} replaces whatever was pending
 * before, and the surviving request is replayed the moment the radio reports
 * {@code POWERED_ON}. A request is never silently dropped: it either runs,
 * is replaced by a newer request, or is cleared explicitly by its owner.</p>
 *
 * <p>The slot is an {@link AtomicReference}: replay takes the operation with
 * {@code getAndSet(null)}, so a request racing with the power-on transition
 * runs exactly once.</p>
 *
 * <h2>Radio loss</h2>
 * <p>On any transition out of {@code POWERED_ON} the {@link RadioLostHandler}
 * is invoked once.</p>
 *
 * <h2>Threading</h2>
 * <p>{@link #requestWhenReady(Runnable)} and {@link #onStateChanged(RadioState)}
 * must be called from the owning manager's serialized context; pending and
 * replayed operations run there too. {@link #state()} may be read from any
 * thread.</p>
 */
public final class RadioStateMonitor
{
    private final RadioLostHandler radioLostHandler;
    private final TransportObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicReference<Runnable> pending = new AtomicReference<>();
    private volatile RadioState state = RadioState.UNKNOWN;

    public RadioStateMonitor(RadioLostHandler radioLostHandler,
                             TransportObservabilitySink observabilitySink,
                             WallClock wallClock)
    {
        this.radioLostHandler = Objects.requireNonNull(radioLostHandler, "radioLostHandler");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public RadioState state() {
        return state;
    }

    public boolean isReady() {
        return state.isReady();
    }

    /**
     * Run {@code operation} now if the radio is ready, otherwise park it in the
     * pending slot, replacing any earlier pending operation.
     *
     * @return {@code true} if the operation ran immediately
     */
    public boolean requestWhenReady(Runnable operation) {
        Objects.requireNonNull(operation, "operation");

        if (state.isReady()) {
            operation.run();
            return true;
        }

        pending.set(operation);
        return false;
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    /**
     * Drop the pending operation, if any.
     */
    public void clearPending() {
        pending.set(null);
    }

    /**
     * Apply a state reported by the platform.
     */
    public void onStateChanged(RadioState newState) {
        Objects.requireNonNull(newState, "newState");

        RadioState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;

        observabilitySink.onRadioTransition(new RadioTransitionEvent(wallClock.now(), oldState, newState));

        if (newState.isReady()) {
            Runnable operation = pending.getAndSet(null);
            if (operation != null) {
                operation.run();
            }
        }
        else if (oldState.isReady()) {
            radioLostHandler.onRadioLost(newState);
        }
    }
}
