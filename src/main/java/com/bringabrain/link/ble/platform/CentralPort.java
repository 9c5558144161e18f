package com.bringabrain.link.ble.platform;

import java.util.Set;
import java.util.UUID;

/**
 * CentralPort
 * -----------------------------------------------------------------------------
 * Port onto the platform's BLE central (GATT client) role, used by a joiner.
 *
 * <p>Every operation is asynchronous; its outcome arrives on the
 * {@link CentralPortListener}.</p>
 */
public interface CentralPort
{
    /**
     * Register the listener that receives radio and connection events. Must
     * be called before any other method.
     */
    void setListener(CentralPortListener listener);

    /**
     * Scan for peripherals advertising {@code serviceId}, without duplicate
     * reports where the platform supports it.
     */
    void startScan(UUID serviceId);

    void stopScan();

    void connect(DeviceHandle peripheral);

    void discoverServices(DeviceHandle peripheral, UUID serviceId);

    void discoverChannels(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels);

    void setNotifyEnabled(DeviceHandle peripheral, UUID channel, boolean enabled);

    /**
     * Write a value without response.
     *
     * @return {@code false} if the platform cannot accept the write right now;
     *         the caller retries after {@link CentralPortListener#onReadyToWrite(DeviceHandle)}
     */
    boolean write(DeviceHandle peripheral, UUID channel, byte[] value);

    /**
     * Current maximum value length for writes on this connection.
     */
    int maximumWriteLength(DeviceHandle peripheral);

    /**
     * Cancel a pending connect or tear down an established connection.
     */
    void cancelConnection(DeviceHandle peripheral);
}
