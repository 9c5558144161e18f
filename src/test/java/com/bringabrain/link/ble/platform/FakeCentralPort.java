package com.bringabrain.link.ble.platform;

import com.bringabrain.link.ble.radio.RadioState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * FakeCentralPort
 * -----------------------------------------------------------------------------
 * Test-only {@link CentralPort} implementation.
 *
 * <p>Records every call and lets tests inject platform callbacks. It never
 * answers a request on its own; tests drive each step of a connect sequence
 * explicitly.</p>
 */
public final class FakeCentralPort implements CentralPort {

    public record Write(DeviceHandle peripheral, UUID channel, byte[] value) {}

    private CentralPortListener listener;
    private boolean scanning;
    private int scanStarts;
    private UUID scannedService;
    private final List<DeviceHandle> connects = new ArrayList<>();
    private final List<DeviceHandle> cancelled = new ArrayList<>();
    private final List<DeviceHandle> serviceDiscoveries = new ArrayList<>();
    private final List<Set<UUID>> channelDiscoveries = new ArrayList<>();
    private final List<UUID> notifyRequests = new ArrayList<>();
    private final List<Write> writes = new ArrayList<>();
    private int writeLength = 185;
    private int busyWrites;

    @Override
    public void setListener(CentralPortListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void startScan(UUID serviceId) {
        scanning = true;
        scanStarts++;
        scannedService = serviceId;
    }

    @Override
    public void stopScan() {
        scanning = false;
    }

    @Override
    public void connect(DeviceHandle peripheral) {
        connects.add(peripheral);
    }

    @Override
    public void discoverServices(DeviceHandle peripheral, UUID serviceId) {
        serviceDiscoveries.add(peripheral);
    }

    @Override
    public void discoverChannels(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels) {
        channelDiscoveries.add(Set.copyOf(channels));
    }

    @Override
    public void setNotifyEnabled(DeviceHandle peripheral, UUID channel, boolean enabled) {
        if (enabled) {
            notifyRequests.add(channel);
        }
    }

    @Override
    public boolean write(DeviceHandle peripheral, UUID channel, byte[] value) {
        if (busyWrites > 0) {
            busyWrites--;
            return false;
        }
        writes.add(new Write(peripheral, channel, value.clone()));
        return true;
    }

    @Override
    public int maximumWriteLength(DeviceHandle peripheral) {
        return writeLength;
    }

    @Override
    public void cancelConnection(DeviceHandle peripheral) {
        cancelled.add(peripheral);
    }

    // ---------------------------------------------------------------------
    // Test helpers: callback injection
    // ---------------------------------------------------------------------

    public void radio(RadioState state) {
        listener().onRadioStateChanged(state);
    }

    public void discovered(DeviceHandle peripheral, String advertisedName, int rssi) {
        listener().onPeripheralDiscovered(peripheral, advertisedName, rssi);
    }

    public void connected(DeviceHandle peripheral) {
        listener().onConnected(peripheral);
    }

    public void connectFailed(DeviceHandle peripheral, Throwable error) {
        listener().onConnectFailed(peripheral, error);
    }

    public void servicesDiscovered(DeviceHandle peripheral, Set<UUID> services, Throwable error) {
        listener().onServicesDiscovered(peripheral, services, error);
    }

    public void channelsDiscovered(DeviceHandle peripheral, Set<UUID> channels, Throwable error) {
        listener().onChannelsDiscovered(peripheral, ServiceLayout.BAB_SERVICE, channels, error);
    }

    public void notifyStateChanged(DeviceHandle peripheral, boolean enabled, Throwable error) {
        listener().onNotifyStateChanged(peripheral, ServiceLayout.BAB_GAME_STATE, enabled, error);
    }

    public void valueUpdated(DeviceHandle peripheral, byte[] value) {
        listener().onValueUpdated(peripheral, ServiceLayout.BAB_GAME_STATE, value);
    }

    public void disconnected(DeviceHandle peripheral, Throwable error) {
        listener().onDisconnected(peripheral, error);
    }

    public void readyToWrite(DeviceHandle peripheral) {
        listener().onReadyToWrite(peripheral);
    }

    // ---------------------------------------------------------------------
    // Test helpers: configuration and inspection
    // ---------------------------------------------------------------------

    public void setWriteLength(int writeLength) {
        this.writeLength = writeLength;
    }

    public void refuseNextWrites(int count) {
        this.busyWrites = count;
    }

    public boolean isScanning() {
        return scanning;
    }

    public int scanStarts() {
        return scanStarts;
    }

    public UUID scannedService() {
        return scannedService;
    }

    public List<DeviceHandle> connects() {
        return Collections.unmodifiableList(connects);
    }

    public List<DeviceHandle> cancelled() {
        return Collections.unmodifiableList(cancelled);
    }

    public List<DeviceHandle> serviceDiscoveries() {
        return Collections.unmodifiableList(serviceDiscoveries);
    }

    public List<Set<UUID>> channelDiscoveries() {
        return Collections.unmodifiableList(channelDiscoveries);
    }

    public List<UUID> notifyRequests() {
        return Collections.unmodifiableList(notifyRequests);
    }

    public List<Write> writes() {
        return Collections.unmodifiableList(writes);
    }

    public List<byte[]> writesTo(UUID channel) {
        List<byte[]> values = new ArrayList<>();
        for (Write w : writes) {
            if (w.channel().equals(channel)) {
                values.add(w.value());
            }
        }
        return values;
    }

    private CentralPortListener listener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
