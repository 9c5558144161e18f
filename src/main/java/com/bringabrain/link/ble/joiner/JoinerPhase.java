package com.bringabrain.link.ble.joiner;

/**
 * Where a joiner is in its connect sequence.
 *
 * <pre>
 *   IDLE → CONNECTING → DISCOVERING_SERVICES → DISCOVERING_CHANNELS → ANNOUNCING → SUBSCRIBING → CONNECTED
 * </pre>
 * Any failure returns to {@code IDLE}.
 */
public enum JoinerPhase
{
    IDLE,
    CONNECTING,
    DISCOVERING_SERVICES,
    DISCOVERING_CHANNELS,

    /** Writing the local display name to the info channel. */
    ANNOUNCING,

    SUBSCRIBING,
    CONNECTED;

    /**
     * True between {@code connect} and either success or failure.
     */
    public boolean isConnecting() {
        return this != IDLE && this != CONNECTED;
    }
}
