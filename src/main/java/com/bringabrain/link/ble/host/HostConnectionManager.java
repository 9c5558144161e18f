package com.bringabrain.link.ble.host;

import com.bringabrain.link.api.Packet;
import com.bringabrain.link.api.Peer;
import com.bringabrain.link.api.PeerId;
import com.bringabrain.link.api.PeerRole;
import com.bringabrain.link.api.TransportError;
import com.bringabrain.link.api.TransportErrorKind;
import com.bringabrain.link.api.TransportListener;
import com.bringabrain.link.ble.config.TransportConfig;
import com.bringabrain.link.ble.config.TransportTimingPolicy;
import com.bringabrain.link.ble.framing.PacketFramer;
import com.bringabrain.link.ble.framing.PacketReassembler;
import com.bringabrain.link.ble.internal.exec.FragmentPump;
import com.bringabrain.link.ble.internal.exec.SerialContext;
import com.bringabrain.link.ble.internal.time.Cancellable;
import com.bringabrain.link.ble.internal.time.WallClock;
import com.bringabrain.link.ble.observability.PeerLifecycleEvent;
import com.bringabrain.link.ble.observability.TransportErrorEvent;
import com.bringabrain.link.ble.observability.TransportObservabilitySink;
import com.bringabrain.link.ble.peer.PeerLink;
import com.bringabrain.link.ble.peer.PeerRegistry;
import com.bringabrain.link.ble.platform.DeviceHandle;
import com.bringabrain.link.ble.platform.PeripheralPort;
import com.bringabrain.link.ble.platform.PeripheralPortListener;
import com.bringabrain.link.ble.platform.ServiceLayout;
import com.bringabrain.link.ble.radio.RadioState;
import com.bringabrain.link.ble.radio.RadioStateMonitor;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * HostConnectionManager
 * =============================================================================
 * Host side of a session: advertises the service, accepts up to
 * {@code maxPeers} joiners, and moves framed packets to and from them.
 *
 * <h2>Execution model</h2>
 * <p>Every input, whether an engine call or a platform callback, is turned
 * into a task on the manager's {@link SerialContext}:</p>
 * <pre>
 *   platform callback → HostEvent → context → handle(event)
 *   engine call       → context → operation
 * </pre>
 * <p>Radio state, the peer registry and the reassembly buffers are touched
 * only from that context. {@link TransportListener} callbacks are delivered
 * there as well.</p>
 *
 * <h2>Peer lifecycle</h2>
 * <ul>
 *   <li>A peer exists from the moment a central subscribes to the notify
 *       channel until it unsubscribes, its link drops, advertising stops, or
 *       the radio is lost.</li>
 *   <li>A subscription that would exceed capacity is refused at the port and
 *       reported as {@link TransportErrorKind#CAPACITY_EXCEEDED}; it never
 *       reaches {@link TransportListener#onPeerConnected}.</li>
 *   <li>A central may announce its display name by writing to the info
 *       channel before subscribing. Otherwise it is named
 *       {@code "Player n"} in order of acceptance.</li>
 * </ul>
 *
 * <h2>Sending</h2>
 * <p>Each link frames with its own packet id counter and with the write
 * length the port reports for that link at send time. Fragments are handed
 * to the link's {@link FragmentPump}.</p>
 */
public final class HostConnectionManager implements AutoCloseable
{
    private final TransportConfig config;
    private final ServiceLayout layout;
    private final PeripheralPort port;
    private final TransportListener listener;
    private final SerialContext context;
    private final TransportObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final RadioStateMonitor radio;
    private final PeerRegistry registry;
    private final PacketReassembler reassembler;
    private final Map<DeviceHandle, String> announcedNames = new HashMap<>();

    private ServiceHandle service;
    private Cancellable sweep = Cancellable.NONE;
    private int acceptedCount;
    private boolean closed;

    // Snapshots for callers outside the context.
    private volatile boolean advertising;
    private volatile List<Peer> peerSnapshot = List.of();

    public HostConnectionManager(TransportConfig config,
                                 PeripheralPort port,
                                 TransportListener listener,
                                 SerialContext context,
                                 TransportObservabilitySink observabilitySink,
                                 WallClock wallClock)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.layout = config.layout();
        this.port = Objects.requireNonNull(port, "port");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.context = Objects.requireNonNull(context, "context");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.radio = new RadioStateMonitor(this::onRadioLost, observabilitySink, wallClock);
        this.registry = new PeerRegistry(config.maxPeers());
        this.reassembler = new PacketReassembler(
                config.timingPolicy().reassemblyTimeout(), context.clock(), wallClock, observabilitySink);

        port.setListener(new PortListener());
    }

    // ---------------------------------------------------------------------
    // Engine-facing operations (any thread)
    // ---------------------------------------------------------------------

    /**
     * Publish the service and advertise under {@code localName}.
     *
     * <p>If the radio is not ready the request is parked until it is, replacing
     * any earlier parked request. While the radio needs user action this is
     * also reported as {@link TransportErrorKind#RADIO_UNAVAILABLE}. A call
     * while already advertising leaves the running session untouched.</p>
     *
     * @return description of the service that is (or will be) advertised
     */
    public ServiceHandle startAdvertising(String localName)
    {
        Objects.requireNonNull(localName, "localName");
        ServiceHandle handle = new ServiceHandle(layout, localName, config.advertisedName(localName));
        context.execute(() -> requestAdvertising(handle));
        return handle;
    }

    /**
     * Stop advertising, remove the service, and release every peer. Each
     * peer sees {@link TransportListener#onPeerDisconnected} before its link
     * is released. Idempotent.
     */
    public void stopAdvertising()
    {
        context.execute(this::teardown);
    }

    /**
     * Send to the packet's target, or to every connected peer if it has none.
     */
    public void send(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");
        context.execute(() -> dispatch(packet));
    }

    /**
     * Tear down as {@link #stopAdvertising()} does and ignore all later
     * requests and platform callbacks.
     */
    @Override
    public void close()
    {
        context.execute(() -> {
            teardown();
            closed = true;
        });
    }

    public boolean isAdvertising()
    {
        return advertising;
    }

    public List<Peer> connectedPeers()
    {
        return peerSnapshot;
    }

    public RadioState radioState()
    {
        return radio.state();
    }

    // ---------------------------------------------------------------------
    // Context-confined handling
    // ---------------------------------------------------------------------

    void handle(HostEvent event)
    {
        if (closed) {
            return;
        }

        if (event instanceof HostEvent.RadioChanged e) {
            onRadioChanged(e.state());
        }
        else if (event instanceof HostEvent.Subscribed e) {
            onSubscribed(e.central(), e.channel());
        }
        else if (event instanceof HostEvent.Unsubscribed e) {
            if (layout.notifyChannel().equals(e.channel())) {
                dropPeer(e.central());
            }
        }
        else if (event instanceof HostEvent.WriteReceived e) {
            onWriteReceived(e.central(), e.channel(), e.value());
        }
        else if (event instanceof HostEvent.CentralDisconnected e) {
            announcedNames.remove(e.central());
            dropPeer(e.central());
        }
        else if (event instanceof HostEvent.ReadyToNotify) {
            for (PeerLink link : registry.links()) {
                link.pump().onReady();
            }
        }
    }

    private void requestAdvertising(ServiceHandle handle)
    {
        if (closed || service != null) {
            return;
        }
        if (!radio.requestWhenReady(() -> beginAdvertising(handle))) {
            reportRadioUnavailable(radio.state());
        }
    }

    private void beginAdvertising(ServiceHandle handle)
    {
        if (closed || service != null) {
            return;
        }

        port.publishService(layout, handle.localName().getBytes(StandardCharsets.UTF_8));
        port.startAdvertising(layout.serviceId(), handle.advertisedName());

        service = handle;
        acceptedCount = 0;
        advertising = true;
        scheduleSweep();
    }

    private void teardown()
    {
        radio.clearPending();
        releaseAllPeers(true);
        announcedNames.clear();

        if (service != null) {
            port.stopAdvertising();
            port.removeAllServices();
            service = null;
        }
        advertising = false;
        sweep.cancel();
        sweep = Cancellable.NONE;
    }

    private void onRadioChanged(RadioState state)
    {
        radio.onStateChanged(state);
        if (radio.hasPending()) {
            reportRadioUnavailable(state);
        }
    }

    private void onRadioLost(RadioState newState)
    {
        // The platform has already dropped every link; nothing to release.
        releaseAllPeers(false);
        announcedNames.clear();
        service = null;
        advertising = false;
        sweep.cancel();
        sweep = Cancellable.NONE;

        listener.onTransportError(TransportError.of(TransportErrorKind.RADIO_UNAVAILABLE, "radio lost: " + newState));
    }

    private void onSubscribed(DeviceHandle central, UUID channel)
    {
        if (!layout.notifyChannel().equals(channel) || registry.contains(central)) {
            return;
        }

        if (service == null) {
            refuse(central, "not advertising");
            return;
        }

        if (registry.isFull()) {
            refuse(central, "at capacity");
            listener.onTransportError(TransportError.of(TransportErrorKind.CAPACITY_EXCEEDED,
                    "refused " + central + ": " + registry.size() + " of " + registry.capacity() + " peers connected"));
            return;
        }

        acceptedCount++;
        String announced = announcedNames.remove(central);
        String displayName = announced != null ? announced : "Player " + acceptedCount;

        TransportTimingPolicy timing = config.timingPolicy();
        FragmentPump pump = new FragmentPump(
                context,
                value -> port.notify(central, layout.notifyChannel(), value),
                timing.interFragmentDelay(),
                timing.busyRetryDelay());

        PeerLink link = registry.register(central, displayName, PeerRole.JOINER, wallClock.now(), pump);
        refreshSnapshot();
        port.acceptSubscription(central);

        observabilitySink.onPeerLifecycle(PeerLifecycleEvent.connected(
                wallClock.now(), link.id(), central.value(), displayName));
        listener.onPeerConnected(link.id(), displayName);
    }

    private void onWriteReceived(DeviceHandle central, UUID channel, byte[] value)
    {
        if (layout.infoChannel().equals(channel)) {
            String name = new String(value, StandardCharsets.UTF_8).strip();
            if (!name.isEmpty()) {
                announcedNames.put(central, name);
            }
            return;
        }

        if (!layout.writeChannel().equals(channel)) {
            return;
        }

        Optional<PeerLink> link = registry.byHandle(central);
        if (link.isEmpty()) {
            return;
        }

        PeerId sender = link.get().id();
        reassembler.accept(sender, value).ifPresent(data -> listener.onDataReceived(sender, data));
    }

    private void dispatch(Packet packet)
    {
        if (closed) {
            return;
        }

        byte[] payload = packet.payload();
        Optional<PeerId> target = packet.targetPeerId();

        if (target.isPresent()) {
            Optional<PeerLink> link = registry.byId(target.get());
            if (link.isEmpty()) {
                listener.onTransportError(new TransportError(
                        TransportErrorKind.WRITE_FAILURE, target.get(), "no connected peer with this id"));
                return;
            }
            sendTo(link.get(), payload);
            return;
        }

        for (PeerLink link : registry.links()) {
            sendTo(link, payload);
        }
    }

    private void sendTo(PeerLink link, byte[] payload)
    {
        int mtu = port.maximumWriteLength(link.handle());
        try {
            PacketFramer.fragmentCount(payload.length, mtu);
        } catch (IllegalArgumentException e) {
            observabilitySink.onError(new TransportErrorEvent(wallClock.now(),
                    "Cannot frame " + payload.length + " bytes for " + link.id(), e));
            listener.onTransportError(new TransportError(TransportErrorKind.WRITE_FAILURE, link.id(), e.getMessage()));
            return;
        }
        link.pump().enqueue(PacketFramer.encodeToWire(link.packetIds().next(), payload, mtu));
    }

    private void dropPeer(DeviceHandle central)
    {
        registry.remove(central).ifPresent(link -> {
            release(link, false);
            refreshSnapshot();
        });
    }

    private void releaseAllPeers(boolean disconnect)
    {
        for (PeerLink link : registry.removeAll()) {
            release(link, disconnect);
        }
        refreshSnapshot();
    }

    private void release(PeerLink link, boolean disconnect)
    {
        link.pump().close();
        reassembler.discard(link.id());

        observabilitySink.onPeerLifecycle(PeerLifecycleEvent.disconnected(
                wallClock.now(), link.id(), link.handle().value(), link.peer().displayName()));
        listener.onPeerDisconnected(link.id());

        if (disconnect) {
            port.disconnect(link.handle());
        }
    }

    private void refuse(DeviceHandle central, String reason)
    {
        announcedNames.remove(central);
        port.rejectSubscription(central);
        observabilitySink.onPeerLifecycle(PeerLifecycleEvent.refused(wallClock.now(), central.value(), reason));
    }

    private void reportRadioUnavailable(RadioState state)
    {
        if (state.needsUserAction()) {
            listener.onTransportError(TransportError.of(TransportErrorKind.RADIO_UNAVAILABLE, "radio is " + state));
        }
    }

    private void scheduleSweep()
    {
        sweep = context.schedule(config.timingPolicy().sweepInterval(), () -> {
            if (service == null) {
                return;
            }
            reassembler.evictStale();
            scheduleSweep();
        });
    }

    private void refreshSnapshot()
    {
        peerSnapshot = registry.peers();
    }

    /**
     * Adapts port callbacks into {@link HostEvent}s on the context.
     */
    private final class PortListener implements PeripheralPortListener
    {
        @Override
        public void onRadioStateChanged(RadioState state)
        {
            submit(new HostEvent.RadioChanged(state));
        }

        @Override
        public void onSubscribed(DeviceHandle central, UUID channel)
        {
            submit(new HostEvent.Subscribed(central, channel));
        }

        @Override
        public void onUnsubscribed(DeviceHandle central, UUID channel)
        {
            submit(new HostEvent.Unsubscribed(central, channel));
        }

        @Override
        public void onWriteReceived(DeviceHandle central, UUID channel, byte[] value)
        {
            submit(new HostEvent.WriteReceived(central, channel, value.clone()));
        }

        @Override
        public void onCentralDisconnected(DeviceHandle central)
        {
            submit(new HostEvent.CentralDisconnected(central));
        }

        @Override
        public void onReadyToNotify()
        {
            submit(new HostEvent.ReadyToNotify());
        }

        private void submit(HostEvent event)
        {
            context.execute(() -> handle(event));
        }
    }
}
