package com.bringabrain.link.ble.platform;

import com.bringabrain.link.ble.radio.RadioState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * SimulatedBleMedium
 * -----------------------------------------------------------------------------
 * In-memory radio connecting one host-side {@link PeripheralPort} to any
 * number of joiner-side {@link CentralPort}s.
 *
 * <p>Every request is answered synchronously through the opposite side's
 * listener, so callbacks land on the managers' serialized contexts in the
 * order a real stack would produce them. Subscriptions stay pending until the
 * host accepts or rejects them.</p>
 */
public final class SimulatedBleMedium {

    public static final DeviceHandle HOST = DeviceHandle.of("host");

    private final HostSide host = new HostSide();
    private final List<JoinerSide> joiners = new ArrayList<>();

    public PeripheralPort hostPort() {
        return host;
    }

    /**
     * Add a joiner device whose connection negotiates the given write length.
     */
    public CentralPort addJoiner(int writeLength) {
        JoinerSide joiner = new JoinerSide(DeviceHandle.of("joiner-" + (joiners.size() + 1)), writeLength);
        joiners.add(joiner);
        return joiner;
    }

    public DeviceHandle handleOf(CentralPort joiner) {
        return ((JoinerSide) joiner).handle;
    }

    public void powerOnAll() {
        hostRadio(RadioState.POWERED_ON);
        for (JoinerSide joiner : joiners) {
            joiner.listener.onRadioStateChanged(RadioState.POWERED_ON);
        }
    }

    /**
     * Change the host radio. Leaving POWERED_ON drops every link.
     */
    public void hostRadio(RadioState state) {
        if (!state.isReady()) {
            host.advertising = false;
            host.layout = null;
            for (JoinerSide joiner : new ArrayList<>(host.links.values())) {
                host.links.remove(joiner.handle);
                host.pending.remove(joiner.handle);
                joiner.connected = false;
                joiner.listener.onDisconnected(HOST, new IllegalStateException("host radio " + state));
            }
        }
        host.listener.onRadioStateChanged(state);
    }

    public int notificationCount() {
        return host.notificationCount;
    }

    private final class HostSide implements PeripheralPort {
        private PeripheralPortListener listener;
        private ServiceLayout layout;
        private boolean advertising;
        private UUID serviceId;
        private String advertisedName;
        private final Map<DeviceHandle, JoinerSide> links = new LinkedHashMap<>();
        private final Map<DeviceHandle, JoinerSide> pending = new HashMap<>();
        private final Map<DeviceHandle, JoinerSide> subscribed = new HashMap<>();
        private int notificationCount;

        @Override
        public void setListener(PeripheralPortListener listener) {
            this.listener = listener;
        }

        @Override
        public void publishService(ServiceLayout layout, byte[] infoValue) {
            this.layout = layout;
        }

        @Override
        public void startAdvertising(UUID serviceId, String localName) {
            this.advertising = true;
            this.serviceId = serviceId;
            this.advertisedName = localName;
            for (JoinerSide joiner : joiners) {
                joiner.offer();
            }
        }

        @Override
        public void stopAdvertising() {
            advertising = false;
        }

        @Override
        public void removeAllServices() {
            layout = null;
            subscribed.clear();
            pending.clear();
        }

        @Override
        public boolean notify(DeviceHandle central, UUID channel, byte[] value) {
            JoinerSide joiner = subscribed.get(central);
            if (joiner != null) {
                notificationCount++;
                joiner.listener.onValueUpdated(HOST, channel, value.clone());
            }
            return true;
        }

        @Override
        public int maximumWriteLength(DeviceHandle central) {
            JoinerSide joiner = links.get(central);
            return joiner == null ? 20 : joiner.writeLength;
        }

        @Override
        public void acceptSubscription(DeviceHandle central) {
            JoinerSide joiner = pending.remove(central);
            if (joiner != null) {
                subscribed.put(central, joiner);
                joiner.listener.onNotifyStateChanged(HOST, layout.notifyChannel(), true, null);
            }
        }

        @Override
        public void rejectSubscription(DeviceHandle central) {
            JoinerSide joiner = pending.remove(central);
            if (joiner != null) {
                IllegalStateException refused = new IllegalStateException("subscription refused");
                joiner.listener.onNotifyStateChanged(HOST, ServiceLayout.BAB_GAME_STATE, false, refused);
                dropLink(joiner, refused);
            }
        }

        @Override
        public void disconnect(DeviceHandle central) {
            JoinerSide joiner = links.get(central);
            if (joiner != null) {
                dropLink(joiner, null);
            }
        }

        private void dropLink(JoinerSide joiner, Throwable reason) {
            links.remove(joiner.handle);
            subscribed.remove(joiner.handle);
            pending.remove(joiner.handle);
            joiner.connected = false;
            joiner.listener.onDisconnected(HOST, reason);
            listener.onCentralDisconnected(joiner.handle);
        }
    }

    private final class JoinerSide implements CentralPort {
        private final DeviceHandle handle;
        private final int writeLength;
        private CentralPortListener listener;
        private boolean scanning;
        private UUID scanFor;
        private boolean connected;

        private JoinerSide(DeviceHandle handle, int writeLength) {
            this.handle = handle;
            this.writeLength = writeLength;
        }

        @Override
        public void setListener(CentralPortListener listener) {
            this.listener = listener;
        }

        @Override
        public void startScan(UUID serviceId) {
            scanning = true;
            scanFor = serviceId;
            offer();
        }

        @Override
        public void stopScan() {
            scanning = false;
        }

        private void offer() {
            if (scanning && host.advertising && host.serviceId.equals(scanFor)) {
                listener.onPeripheralDiscovered(HOST, host.advertisedName, -55);
            }
        }

        @Override
        public void connect(DeviceHandle peripheral) {
            if (HOST.equals(peripheral) && host.advertising) {
                connected = true;
                host.links.put(handle, this);
                listener.onConnected(peripheral);
            }
            else {
                listener.onConnectFailed(peripheral, new IllegalStateException("peripheral not reachable"));
            }
        }

        @Override
        public void discoverServices(DeviceHandle peripheral, UUID serviceId) {
            Set<UUID> services = host.layout == null ? Set.of() : Set.of(host.layout.serviceId());
            listener.onServicesDiscovered(peripheral, services, null);
        }

        @Override
        public void discoverChannels(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels) {
            Set<UUID> found = host.layout == null ? Set.of() : host.layout.channels();
            listener.onChannelsDiscovered(peripheral, serviceId, found, null);
        }

        @Override
        public void setNotifyEnabled(DeviceHandle peripheral, UUID channel, boolean enabled) {
            if (enabled) {
                host.pending.put(handle, this);
                host.listener.onSubscribed(handle, channel);
            }
            else {
                host.subscribed.remove(handle);
                host.listener.onUnsubscribed(handle, channel);
                listener.onNotifyStateChanged(peripheral, channel, false, null);
            }
        }

        @Override
        public boolean write(DeviceHandle peripheral, UUID channel, byte[] value) {
            if (connected) {
                host.listener.onWriteReceived(handle, channel, value.clone());
            }
            return true;
        }

        @Override
        public int maximumWriteLength(DeviceHandle peripheral) {
            return writeLength;
        }

        @Override
        public void cancelConnection(DeviceHandle peripheral) {
            if (!connected) {
                return;
            }
            connected = false;
            host.links.remove(handle);
            host.subscribed.remove(handle);
            host.pending.remove(handle);
            host.listener.onCentralDisconnected(handle);
            listener.onDisconnected(peripheral, null);
        }
    }
}
