package com.bringabrain.link.ble.joiner;

import com.bringabrain.link.ble.platform.DeviceHandle;
import com.bringabrain.link.ble.radio.RadioState;

import java.util.Set;
import java.util.UUID;

/**
 * JoinerEvent
 * -----------------------------------------------------------------------------
 * Central-port callbacks captured as immutable values for hand-off to the
 * joiner manager's serialized context.
 *
 * <p>{@code error} components are {@code null} on success.</p>
 */
public sealed interface JoinerEvent
        permits JoinerEvent.RadioChanged,
                JoinerEvent.PeripheralDiscovered,
                JoinerEvent.Connected,
                JoinerEvent.ConnectFailed,
                JoinerEvent.ServicesDiscovered,
                JoinerEvent.ChannelsDiscovered,
                JoinerEvent.NotifyStateChanged,
                JoinerEvent.ValueUpdated,
                JoinerEvent.Disconnected,
                JoinerEvent.ReadyToWrite
{
    record RadioChanged(RadioState state) implements JoinerEvent {}

    record PeripheralDiscovered(DeviceHandle peripheral, String advertisedName, int rssi) implements JoinerEvent {}

    record Connected(DeviceHandle peripheral) implements JoinerEvent {}

    record ConnectFailed(DeviceHandle peripheral, Throwable error) implements JoinerEvent {}

    record ServicesDiscovered(DeviceHandle peripheral, Set<UUID> services, Throwable error) implements JoinerEvent {}

    record ChannelsDiscovered(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels, Throwable error)
            implements JoinerEvent {}

    record NotifyStateChanged(DeviceHandle peripheral, UUID channel, boolean enabled, Throwable error)
            implements JoinerEvent {}

    record ValueUpdated(DeviceHandle peripheral, UUID channel, byte[] value) implements JoinerEvent {}

    record Disconnected(DeviceHandle peripheral, Throwable error) implements JoinerEvent {}

    record ReadyToWrite(DeviceHandle peripheral) implements JoinerEvent {}
}
