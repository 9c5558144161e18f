package com.bringabrain.link.ble.joiner;

import com.bringabrain.link.ble.platform.DeviceHandle;

import java.util.Objects;

/**
 * A host seen while scanning.
 *
 * @param name advertised local name, or {@code "Unknown Host"} if it advertised none
 * @param rssi signal strength of the first sighting, in dBm
 */
public record DiscoveredHost(
    DeviceHandle handle,
    String name,
    int rssi
) {
    public static final String UNKNOWN_NAME = "Unknown Host";

    public DiscoveredHost {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(name, "name");
    }

    static DiscoveredHost of(DeviceHandle handle, String advertisedName, int rssi) {
        String name = (advertisedName == null || advertisedName.isBlank()) ? UNKNOWN_NAME : advertisedName;
        return new DiscoveredHost(handle, name, rssi);
    }
}
