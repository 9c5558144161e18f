package com.bringabrain.link.ble.observability;

import com.bringabrain.link.ble.radio.RadioState;

import java.time.Instant;

/**
 * Record of a local radio state change.
 */
public record RadioTransitionEvent(
    Instant timestamp,
    RadioState oldState,
    RadioState newState
) {
    /**
     * True if this transition ends a {@link RadioState#POWERED_ON} period.
     */
    public boolean isRadioLost() {
        return oldState.isReady() && !newState.isReady();
    }
}
