package com.bringabrain.link.ble.platform;

import java.util.UUID;

/**
 * PeripheralPort
 * -----------------------------------------------------------------------------
 * Port onto the platform's BLE peripheral (GATT server) role, used by the host.
 *
 * <p>Implementations wrap CoreBluetooth's peripheral manager, Android's
 * {@code BluetoothGattServer} plus advertiser, or a simulator. They perform
 * radio I/O only: no fragmentation, no peer bookkeeping, no retries.</p>
 */
public interface PeripheralPort
{
    /**
     * Register the listener that receives radio and connection events.
     *
     * <p>This must be called before any other method. The listener may be
     * invoked from any platform thread.</p>
     */
    void setListener(PeripheralPortListener listener);

    /**
     * Publish the service with its three channels. The info channel is
     * readable and initially holds {@code infoValue}.
     */
    void publishService(ServiceLayout layout, byte[] infoValue);

    /**
     * Begin advertising the service identifier and local name.
     */
    void startAdvertising(UUID serviceId, String localName);

    void stopAdvertising();

    /**
     * Remove every published service. Connected centrals lose their
     * subscriptions.
     */
    void removeAllServices();

    /**
     * Send one notification to one subscribed central.
     *
     * @return {@code false} if the platform's outgoing queue is full; the
     *         caller retries after {@link PeripheralPortListener#onReadyToNotify()}
     */
    boolean notify(DeviceHandle central, UUID channel, byte[] value);

    /**
     * Current maximum value length for notifications to this central, derived
     * from the MTU negotiated on that connection. May change over the life of
     * the connection.
     */
    int maximumWriteLength(DeviceHandle central);

    /**
     * Confirm a pending subscription reported through
     * {@link PeripheralPortListener#onSubscribed(DeviceHandle, java.util.UUID)}.
     * Stacks that confirm subscriptions on their own implement this as a no-op.
     */
    void acceptSubscription(DeviceHandle central);

    /**
     * Refuse a pending subscription: the central's subscribe request fails
     * and the platform drops its link without it ever becoming a peer.
     */
    void rejectSubscription(DeviceHandle central);

    /**
     * Release the link to a central.
     */
    void disconnect(DeviceHandle central);
}
