package com.bringabrain.link.ble.radio;

/**
 * Availability of the local Bluetooth radio, as pushed by the platform.
 *
 * <p>Only {@link #POWERED_ON} permits advertising, scanning, or connecting.</p>
 */
public enum RadioState
{
    /** Not reported yet, or the stack is resetting. */
    UNKNOWN,

    /** The device has no BLE support. */
    UNSUPPORTED,

    /** The user has not granted Bluetooth permission. */
    UNAUTHORIZED,

    POWERED_OFF,

    POWERED_ON;

    public boolean isReady() {
        return this == POWERED_ON;
    }

    /**
     * True for states that will not resolve without user action: the
     * presentation layer shows a permission or power prompt for these.
     */
    public boolean needsUserAction() {
        return this == UNSUPPORTED || this == UNAUTHORIZED || this == POWERED_OFF;
    }
}
