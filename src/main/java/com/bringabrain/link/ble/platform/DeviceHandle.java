package com.bringabrain.link.ble.platform;

import java.util.Objects;

/**
 * Opaque platform identifier of a remote device (a CoreBluetooth peer
 * identifier, an Android device address, or a simulator id).
 *
 * <p>The transport never interprets the value. It is only used to route
 * platform calls and to key the peer registry.</p>
 */
public record DeviceHandle(String value)
{
    public DeviceHandle {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("DeviceHandle must not be empty");
        }
    }

    public static DeviceHandle of(String value) {
        return new DeviceHandle(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
