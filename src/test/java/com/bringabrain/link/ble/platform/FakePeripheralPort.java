package com.bringabrain.link.ble.platform;

import com.bringabrain.link.ble.radio.RadioState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * FakePeripheralPort
 * -----------------------------------------------------------------------------
 * Test-only {@link PeripheralPort} implementation.
 *
 * <p>Contains no transport semantics: it records every call and lets tests
 * inject platform callbacks. Calls that release or refuse a device are also
 * appended to a shared call log as {@code "<call>:<device>"}.</p>
 */
public final class FakePeripheralPort implements PeripheralPort {

    public record Notification(DeviceHandle central, UUID channel, byte[] value) {}

    private final List<String> log;

    private PeripheralPortListener listener;
    private ServiceLayout publishedLayout;
    private byte[] infoValue;
    private boolean advertising;
    private UUID advertisedService;
    private String advertisedName;
    private int publishCount;

    private final List<Notification> notifications = new ArrayList<>();
    private final List<DeviceHandle> accepted = new ArrayList<>();
    private final List<DeviceHandle> rejected = new ArrayList<>();
    private final List<DeviceHandle> disconnected = new ArrayList<>();
    private final Map<DeviceHandle, Integer> writeLengths = new HashMap<>();
    private int defaultWriteLength = 185;
    private int busyNotifications;

    public FakePeripheralPort() {
        this(new ArrayList<>());
    }

    public FakePeripheralPort(List<String> log) {
        this.log = log;
    }

    @Override
    public void setListener(PeripheralPortListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void publishService(ServiceLayout layout, byte[] infoValue) {
        this.publishedLayout = layout;
        this.infoValue = infoValue.clone();
        publishCount++;
        log.add("publishService");
    }

    @Override
    public void startAdvertising(UUID serviceId, String localName) {
        advertising = true;
        advertisedService = serviceId;
        advertisedName = localName;
        log.add("startAdvertising");
    }

    @Override
    public void stopAdvertising() {
        advertising = false;
        log.add("stopAdvertising");
    }

    @Override
    public void removeAllServices() {
        publishedLayout = null;
        infoValue = null;
        log.add("removeAllServices");
    }

    @Override
    public boolean notify(DeviceHandle central, UUID channel, byte[] value) {
        if (busyNotifications > 0) {
            busyNotifications--;
            return false;
        }
        notifications.add(new Notification(central, channel, value.clone()));
        return true;
    }

    @Override
    public int maximumWriteLength(DeviceHandle central) {
        return writeLengths.getOrDefault(central, defaultWriteLength);
    }

    @Override
    public void acceptSubscription(DeviceHandle central) {
        accepted.add(central);
    }

    @Override
    public void rejectSubscription(DeviceHandle central) {
        rejected.add(central);
        log.add("rejectSubscription:" + central.value());
    }

    @Override
    public void disconnect(DeviceHandle central) {
        disconnected.add(central);
        log.add("disconnect:" + central.value());
    }

    // ---------------------------------------------------------------------
    // Test helpers: callback injection
    // ---------------------------------------------------------------------

    public void radio(RadioState state) {
        listener().onRadioStateChanged(state);
    }

    public void subscribe(DeviceHandle central) {
        subscribe(central, ServiceLayout.BAB_GAME_STATE);
    }

    public void subscribe(DeviceHandle central, UUID channel) {
        listener().onSubscribed(central, channel);
    }

    public void unsubscribe(DeviceHandle central) {
        listener().onUnsubscribed(central, ServiceLayout.BAB_GAME_STATE);
    }

    public void write(DeviceHandle central, UUID channel, byte[] value) {
        listener().onWriteReceived(central, channel, value);
    }

    public void writeAll(DeviceHandle central, UUID channel, List<byte[]> values) {
        for (byte[] value : values) {
            write(central, channel, value);
        }
    }

    public void centralDisconnected(DeviceHandle central) {
        listener().onCentralDisconnected(central);
    }

    public void readyToNotify() {
        listener().onReadyToNotify();
    }

    // ---------------------------------------------------------------------
    // Test helpers: configuration and inspection
    // ---------------------------------------------------------------------

    public void setWriteLength(DeviceHandle central, int length) {
        writeLengths.put(central, length);
    }

    public void setDefaultWriteLength(int length) {
        this.defaultWriteLength = length;
    }

    /**
     * Refuse the next {@code count} notifications as if the outgoing queue were full.
     */
    public void refuseNextNotifications(int count) {
        this.busyNotifications = count;
    }

    public List<Notification> notifications() {
        return Collections.unmodifiableList(notifications);
    }

    public List<byte[]> notificationsTo(DeviceHandle central) {
        List<byte[]> values = new ArrayList<>();
        for (Notification n : notifications) {
            if (n.central().equals(central)) {
                values.add(n.value());
            }
        }
        return values;
    }

    public void clearNotifications() {
        notifications.clear();
    }

    public List<DeviceHandle> accepted() {
        return Collections.unmodifiableList(accepted);
    }

    public List<DeviceHandle> rejected() {
        return Collections.unmodifiableList(rejected);
    }

    public List<DeviceHandle> disconnected() {
        return Collections.unmodifiableList(disconnected);
    }

    public boolean isAdvertising() {
        return advertising;
    }

    public String advertisedName() {
        return advertisedName;
    }

    public UUID advertisedService() {
        return advertisedService;
    }

    public ServiceLayout publishedLayout() {
        return publishedLayout;
    }

    public byte[] infoValue() {
        return infoValue == null ? null : infoValue.clone();
    }

    public int publishCount() {
        return publishCount;
    }

    public boolean hasListener() {
        return listener != null;
    }

    private PeripheralPortListener listener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
