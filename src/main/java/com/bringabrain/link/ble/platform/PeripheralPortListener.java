package com.bringabrain.link.ble.platform;

import com.bringabrain.link.ble.radio.RadioState;

import java.util.UUID;

/**
 * Callback sink for {@link PeripheralPort}.
 *
 * <p>Implementations inside this library never touch manager state from
 * these callbacks; they forward them into the manager's serialized context.</p>
 */
public interface PeripheralPortListener
{
    void onRadioStateChanged(RadioState state);

    /**
     * A central asked to enable notifications on a channel. The request stays
     * pending until {@link PeripheralPort#acceptSubscription(DeviceHandle)} or
     * {@link PeripheralPort#rejectSubscription(DeviceHandle)}.
     */
    void onSubscribed(DeviceHandle central, UUID channel);

    /**
     * A central disabled notifications on a channel.
     */
    void onUnsubscribed(DeviceHandle central, UUID channel);

    /**
     * A central wrote a value. The payload is handed over as received; the
     * platform has already acknowledged the write request.
     */
    void onWriteReceived(DeviceHandle central, UUID channel, byte[] value);

    /**
     * The link to a central dropped.
     */
    void onCentralDisconnected(DeviceHandle central);

    /**
     * The outgoing notification queue has room again.
     */
    void onReadyToNotify();
}
