package com.bringabrain.link.ble.host;

import com.bringabrain.link.ble.platform.DeviceHandle;
import com.bringabrain.link.ble.radio.RadioState;

import java.util.UUID;

/**
 * HostEvent
 * -----------------------------------------------------------------------------
 * Peripheral-port callbacks, captured as immutable values so they can cross
 * from the platform's callback thread into the host manager's serialized
 * context.
 *
 * <p>Events carry only what the port reported. Interpretation happens in
 * {@link HostConnectionManager}.</p>
 */
public sealed interface HostEvent
        permits HostEvent.RadioChanged,
                HostEvent.Subscribed,
                HostEvent.Unsubscribed,
                HostEvent.WriteReceived,
                HostEvent.CentralDisconnected,
                HostEvent.ReadyToNotify
{
    record RadioChanged(RadioState state) implements HostEvent {}

    record Subscribed(DeviceHandle central, UUID channel) implements HostEvent {}

    record Unsubscribed(DeviceHandle central, UUID channel) implements HostEvent {}

    /** The value has already been copied off the platform buffer. */
    record WriteReceived(DeviceHandle central, UUID channel, byte[] value) implements HostEvent {}

    record CentralDisconnected(DeviceHandle central) implements HostEvent {}

    record ReadyToNotify() implements HostEvent {}
}
