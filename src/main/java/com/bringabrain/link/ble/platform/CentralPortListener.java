package com.bringabrain.link.ble.platform;

import com.bringabrain.link.ble.radio.RadioState;

import java.util.Set;
import java.util.UUID;

/**
 * Callback sink for {@link CentralPort}.
 *
 * <p>{@code error} arguments are {@code null} on success.</p>
 */
public interface CentralPortListener
{
    void onRadioStateChanged(RadioState state);

    /**
     * @param advertisedName advertised local name, or {@code null} if none was seen
     */
    void onPeripheralDiscovered(DeviceHandle peripheral, String advertisedName, int rssi);

    void onConnected(DeviceHandle peripheral);

    void onConnectFailed(DeviceHandle peripheral, Throwable error);

    void onServicesDiscovered(DeviceHandle peripheral, Set<UUID> services, Throwable error);

    void onChannelsDiscovered(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels, Throwable error);

    void onNotifyStateChanged(DeviceHandle peripheral, UUID channel, boolean enabled, Throwable error);

    void onValueUpdated(DeviceHandle peripheral, UUID channel, byte[] value);

    void onDisconnected(DeviceHandle peripheral, Throwable error);

    void onReadyToWrite(DeviceHandle peripheral);
}
