package com.bringabrain.link.ble.joiner;

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
import com.bringabrain.link.ble.platform.CentralPort;
import com.bringabrain.link.ble.platform.CentralPortListener;
import com.bringabrain.link.ble.platform.DeviceHandle;
import com.bringabrain.link.ble.platform.ServiceLayout;
import com.bringabrain.link.ble.radio.RadioState;
import com.bringabrain.link.ble.radio.RadioStateMonitor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JoinerConnectionManager
 * =============================================================================
 * Joiner side of a session: scans for hosts, connects to one, and moves
 * framed packets to and from it.
 *
 * <h2>Connect sequence</h2>
 * <pre>
 *   connect → discover service → discover channels → announce name → subscribe
 * </pre>
 * <p>The host becomes a peer only when the notify subscription is confirmed.
 * Any failure on the way, a disconnect before completion, or expiry of the
 * connection timeout cancels the platform connection and ends in exactly one
 * terminal {@link TransportError}; no half-initialized connection is left
 * behind.</p>
 *
 * <h2>Scanning</h2>
 * <p>A scan reports each platform identifier at most once and runs until its
 * duration elapses or the caller stops it. Finding a host does not end the
 * scan. {@link #connect(DiscoveredHost)} stops it first.</p>
 *
 * <h2>Execution model</h2>
 * <p>As in the host manager, every input is a task on the manager's
 * {@link SerialContext}, and all state is confined to it.</p>
 */
public final class JoinerConnectionManager implements AutoCloseable
{
    private final TransportConfig config;
    private final ServiceLayout layout;
    private final CentralPort port;
    private final TransportListener listener;
    private final SerialContext context;
    private final TransportObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final RadioStateMonitor radio;
    private final PeerRegistry registry = new PeerRegistry(1);
    private final PacketReassembler reassembler;

    // Scan state
    private final Map<DeviceHandle, DiscoveredHost> discovered = new LinkedHashMap<>();
    private ScanListener scanListener;
    private boolean scanning;
    private Cancellable scanTimer = Cancellable.NONE;

    // Connection state
    private JoinerPhase phase = JoinerPhase.IDLE;
    private DiscoveredHost target;
    private PeerLink hostLink;
    private Cancellable connectTimer = Cancellable.NONE;
    private Cancellable announceRetry = Cancellable.NONE;
    private Cancellable sweep = Cancellable.NONE;

    private boolean closed;

    private volatile JoinerPhase phaseSnapshot = JoinerPhase.IDLE;
    private volatile Peer hostSnapshot;
    private volatile List<DiscoveredHost> discoveredSnapshot = List.of();
    private volatile boolean scanningSnapshot;

    public JoinerConnectionManager(TransportConfig config,
                                   CentralPort port,
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
        this.reassembler = new PacketReassembler(
                config.timingPolicy().reassemblyTimeout(), context.clock(), wallClock, observabilitySink);

        port.setListener(new PortListener());
    }

    // ---------------------------------------------------------------------
    // Engine-facing operations (any thread)
    // ---------------------------------------------------------------------

    /**
     * Scan for the configured default duration.
     */
    public void startScanning(ScanListener scanListener)
    {
        startScanning(config.timingPolicy().scanDuration(), scanListener);
    }

    /**
     * Scan for hosts for up to {@code duration}.
     *
     * <p>Queued until the radio is ready, replacing any earlier queued
     * request. Restarting an active scan begins a fresh result set. Ignored
     * while a connection is in progress or established.</p>
     */
    public void startScanning(Duration duration, ScanListener scanListener)
    {
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(scanListener, "scanListener");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("duration must be positive");
        }
        context.execute(() -> requestScan(duration, scanListener));
    }

    /**
     * Stop scanning and drop a queued scan request. Idempotent.
     */
    public void stopScanning()
    {
        context.execute(() -> {
            radio.clearPending();
            finishScan();
        });
    }

    /**
     * Connect to a discovered host. Stops any scan first.
     *
     * <p>If the radio is not ready this fails at once with
     * {@link TransportErrorKind#RADIO_UNAVAILABLE}; connects are not queued.</p>
     */
    public void connect(DiscoveredHost host)
    {
        Objects.requireNonNull(host, "host");
        context.execute(() -> beginConnect(host));
    }

    /**
     * Send to the host. Any target on the packet is ignored; with no host
     * connected the packet is reported as {@link TransportErrorKind#WRITE_FAILURE}.
     */
    public void send(Packet packet)
    {
        Objects.requireNonNull(packet, "packet");
        context.execute(() -> dispatch(packet));
    }

    /**
     * Release the host connection, or abandon a connect in progress.
     * Idempotent.
     */
    public void disconnect()
    {
        context.execute(() -> {
            radio.clearPending();
            releaseConnection();
        });
    }

    @Override
    public void close()
    {
        context.execute(() -> {
            radio.clearPending();
            finishScan();
            releaseConnection();
            closed = true;
        });
    }

    public JoinerPhase phase()
    {
        return phaseSnapshot;
    }

    public Optional<Peer> hostPeer()
    {
        return Optional.ofNullable(hostSnapshot);
    }

    public List<DiscoveredHost> discoveredHosts()
    {
        return discoveredSnapshot;
    }

    public boolean isScanning()
    {
        return scanningSnapshot;
    }

    public RadioState radioState()
    {
        return radio.state();
    }

    // ---------------------------------------------------------------------
    // Context-confined handling
    // ---------------------------------------------------------------------

    void handle(JoinerEvent event)
    {
        if (closed) {
            return;
        }

        if (event instanceof JoinerEvent.RadioChanged e) {
            radio.onStateChanged(e.state());
            if (radio.hasPending()) {
                reportRadioUnavailable(e.state());
            }
        }
        else if (event instanceof JoinerEvent.PeripheralDiscovered e) {
            onDiscovered(e.peripheral(), e.advertisedName(), e.rssi());
        }
        else if (event instanceof JoinerEvent.Connected e) {
            if (isTarget(e.peripheral(), JoinerPhase.CONNECTING)) {
                advance(JoinerPhase.DISCOVERING_SERVICES);
                port.discoverServices(e.peripheral(), layout.serviceId());
            }
        }
        else if (event instanceof JoinerEvent.ConnectFailed e) {
            if (isTarget(e.peripheral(), JoinerPhase.CONNECTING)) {
                failConnection(TransportErrorKind.CONNECTION_FAILED, describe("connect failed", e.error()));
            }
        }
        else if (event instanceof JoinerEvent.ServicesDiscovered e) {
            if (isTarget(e.peripheral(), JoinerPhase.DISCOVERING_SERVICES)) {
                onServicesDiscovered(e.peripheral(), e.services(), e.error());
            }
        }
        else if (event instanceof JoinerEvent.ChannelsDiscovered e) {
            if (isTarget(e.peripheral(), JoinerPhase.DISCOVERING_CHANNELS)) {
                onChannelsDiscovered(e.peripheral(), e.channels(), e.error());
            }
        }
        else if (event instanceof JoinerEvent.NotifyStateChanged e) {
            if (isTarget(e.peripheral(), JoinerPhase.SUBSCRIBING) && layout.notifyChannel().equals(e.channel())) {
                onNotifyStateChanged(e.peripheral(), e.enabled(), e.error());
            }
        }
        else if (event instanceof JoinerEvent.ValueUpdated e) {
            onValueUpdated(e.peripheral(), e.channel(), e.value());
        }
        else if (event instanceof JoinerEvent.Disconnected e) {
            onDisconnected(e.peripheral(), e.error());
        }
        else if (event instanceof JoinerEvent.ReadyToWrite e) {
            if (hostLink != null && hostLink.handle().equals(e.peripheral())) {
                hostLink.pump().onReady();
            }
            else if (isTarget(e.peripheral(), JoinerPhase.ANNOUNCING)) {
                announce(e.peripheral());
            }
        }
    }

    // --- scanning ---

    private void requestScan(Duration duration, ScanListener scanListener)
    {
        if (closed || phase != JoinerPhase.IDLE) {
            return;
        }
        if (!radio.requestWhenReady(() -> beginScan(duration, scanListener))) {
            reportRadioUnavailable(radio.state());
        }
    }

    private void beginScan(Duration duration, ScanListener newListener)
    {
        if (closed || phase != JoinerPhase.IDLE) {
            return;
        }
        finishScan();

        discovered.clear();
        discoveredSnapshot = List.of();
        scanListener = newListener;
        scanning = true;
        scanningSnapshot = true;

        port.startScan(layout.serviceId());
        scanTimer = context.schedule(duration, this::finishScan);
    }

    private void finishScan()
    {
        if (!scanning) {
            return;
        }
        scanning = false;
        scanningSnapshot = false;
        scanTimer.cancel();
        scanTimer = Cancellable.NONE;
        port.stopScan();

        ScanListener finished = scanListener;
        scanListener = null;
        finished.onScanFinished();
    }

    private void onDiscovered(DeviceHandle peripheral, String advertisedName, int rssi)
    {
        if (!scanning || discovered.containsKey(peripheral)) {
            return;
        }
        DiscoveredHost host = DiscoveredHost.of(peripheral, advertisedName, rssi);
        discovered.put(peripheral, host);
        discoveredSnapshot = List.copyOf(discovered.values());
        scanListener.onHostDiscovered(host);
    }

    // --- connecting ---

    private void beginConnect(DiscoveredHost host)
    {
        if (closed) {
            return;
        }
        if (phase != JoinerPhase.IDLE) {
            observabilitySink.onError(new TransportErrorEvent(wallClock.now(),
                    "Ignoring connect to " + host.handle() + " while " + phase, null));
            return;
        }

        finishScan();

        if (!radio.isReady()) {
            listener.onTransportError(TransportError.of(TransportErrorKind.RADIO_UNAVAILABLE,
                    "cannot connect while radio is " + radio.state()));
            return;
        }

        target = host;
        advance(JoinerPhase.CONNECTING);
        connectTimer = context.schedule(config.timingPolicy().connectionTimeout(),
                () -> failConnection(TransportErrorKind.CONNECTION_TIMEOUT,
                        "no connection to " + host.handle() + " within " + config.timingPolicy().connectionTimeout()));
        port.connect(host.handle());
    }

    private void onServicesDiscovered(DeviceHandle peripheral, Set<UUID> services, Throwable error)
    {
        if (error != null || services == null || !services.contains(layout.serviceId())) {
            failConnection(TransportErrorKind.SERVICE_NOT_FOUND, describe("service discovery failed", error));
            return;
        }
        advance(JoinerPhase.DISCOVERING_CHANNELS);
        port.discoverChannels(peripheral, layout.serviceId(), layout.channels());
    }

    private void onChannelsDiscovered(DeviceHandle peripheral, Set<UUID> channels, Throwable error)
    {
        if (error != null || channels == null || !channels.containsAll(layout.channels())) {
            failConnection(TransportErrorKind.CHANNEL_NOT_FOUND, describe("channel discovery failed", error));
            return;
        }

        advance(JoinerPhase.ANNOUNCING);
        announce(peripheral);
    }

    /**
     * Write the display name, then subscribe. A busy port is retried after
     * {@code busyRetryDelay} or on readiness; the connect timeout bounds it.
     */
    private void announce(DeviceHandle peripheral)
    {
        if (!isTarget(peripheral, JoinerPhase.ANNOUNCING)) {
            return;
        }
        announceRetry.cancel();
        announceRetry = Cancellable.NONE;

        if (!port.write(peripheral, layout.infoChannel(), config.localDisplayName().getBytes(StandardCharsets.UTF_8))) {
            announceRetry = context.schedule(config.timingPolicy().busyRetryDelay(), () -> announce(peripheral));
            return;
        }

        advance(JoinerPhase.SUBSCRIBING);
        port.setNotifyEnabled(peripheral, layout.notifyChannel(), true);
    }

    private void onNotifyStateChanged(DeviceHandle peripheral, boolean enabled, Throwable error)
    {
        if (error != null || !enabled) {
            failConnection(TransportErrorKind.CONNECTION_FAILED, describe("subscription failed", error));
            return;
        }

        connectTimer.cancel();
        connectTimer = Cancellable.NONE;

        TransportTimingPolicy timing = config.timingPolicy();
        FragmentPump pump = new FragmentPump(
                context,
                value -> port.write(peripheral, layout.writeChannel(), value),
                timing.interFragmentDelay(),
                timing.busyRetryDelay());

        hostLink = registry.register(peripheral, target.name(), PeerRole.HOST, wallClock.now(), pump);
        hostSnapshot = hostLink.peer();
        advance(JoinerPhase.CONNECTED);
        scheduleSweep();

        observabilitySink.onPeerLifecycle(PeerLifecycleEvent.connected(
                wallClock.now(), hostLink.id(), peripheral.value(), target.name()));
        listener.onPeerConnected(hostLink.id(), target.name());
    }

    private void onDisconnected(DeviceHandle peripheral, Throwable error)
    {
        if (target == null || !target.handle().equals(peripheral)) {
            return;
        }
        if (phase.isConnecting()) {
            failConnection(TransportErrorKind.CONNECTION_FAILED, describe("disconnected during setup", error));
        }
        else if (phase == JoinerPhase.CONNECTED) {
            releaseHost(false);
        }
    }

    private void failConnection(TransportErrorKind kind, String detail)
    {
        if (!phase.isConnecting()) {
            return;
        }
        DeviceHandle handle = target.handle();
        abandonSetup();
        port.cancelConnection(handle);

        observabilitySink.onError(new TransportErrorEvent(wallClock.now(),
                kind + " for " + handle + ": " + detail, null));
        listener.onTransportError(TransportError.of(kind, detail));
    }

    private void abandonSetup()
    {
        connectTimer.cancel();
        connectTimer = Cancellable.NONE;
        announceRetry.cancel();
        announceRetry = Cancellable.NONE;
        target = null;
        advance(JoinerPhase.IDLE);
    }

    // --- established connection ---

    private void onValueUpdated(DeviceHandle peripheral, UUID channel, byte[] value)
    {
        if (hostLink == null || !hostLink.handle().equals(peripheral) || !layout.notifyChannel().equals(channel)) {
            return;
        }
        PeerId host = hostLink.id();
        reassembler.accept(host, value).ifPresent(data -> listener.onDataReceived(host, data));
    }

    private void dispatch(Packet packet)
    {
        if (closed) {
            return;
        }
        if (hostLink == null) {
            listener.onTransportError(TransportError.of(TransportErrorKind.WRITE_FAILURE, "not connected to a host"));
            return;
        }

        byte[] payload = packet.payload();
        int mtu = port.maximumWriteLength(hostLink.handle());
        try {
            PacketFramer.fragmentCount(payload.length, mtu);
        } catch (IllegalArgumentException e) {
            observabilitySink.onError(new TransportErrorEvent(wallClock.now(),
                    "Cannot frame " + payload.length + " bytes for host", e));
            listener.onTransportError(new TransportError(TransportErrorKind.WRITE_FAILURE, hostLink.id(), e.getMessage()));
            return;
        }
        hostLink.pump().enqueue(PacketFramer.encodeToWire(hostLink.packetIds().next(), payload, mtu));
    }

    private void releaseConnection()
    {
        if (phase == JoinerPhase.CONNECTED) {
            releaseHost(true);
        }
        else if (phase.isConnecting()) {
            DeviceHandle handle = target.handle();
            abandonSetup();
            port.cancelConnection(handle);
        }
    }

    private void releaseHost(boolean cancel)
    {
        PeerLink link = hostLink;
        hostLink = null;
        hostSnapshot = null;
        target = null;
        registry.removeAll();
        sweep.cancel();
        sweep = Cancellable.NONE;
        advance(JoinerPhase.IDLE);

        link.pump().close();
        reassembler.discard(link.id());

        observabilitySink.onPeerLifecycle(PeerLifecycleEvent.disconnected(
                wallClock.now(), link.id(), link.handle().value(), link.peer().displayName()));
        listener.onPeerDisconnected(link.id());

        if (cancel) {
            port.cancelConnection(link.handle());
        }
    }

    private void onRadioLost(RadioState newState)
    {
        finishScan();
        if (phase == JoinerPhase.CONNECTED) {
            releaseHost(false);
        }
        else if (phase.isConnecting()) {
            abandonSetup();
        }
        // Every lost state is reported, UNKNOWN included.
        listener.onTransportError(TransportError.of(TransportErrorKind.RADIO_UNAVAILABLE, "radio lost: " + newState));
    }

    // --- helpers ---

    private boolean isTarget(DeviceHandle peripheral, JoinerPhase expected)
    {
        return phase == expected && target != null && target.handle().equals(peripheral);
    }

    private void advance(JoinerPhase next)
    {
        phase = next;
        phaseSnapshot = next;
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
            if (hostLink == null) {
                return;
            }
            reassembler.evictStale();
            scheduleSweep();
        });
    }

    private static String describe(String what, Throwable error)
    {
        return error == null ? what : what + ": " + error.getMessage();
    }

    /**
     * Adapts port callbacks into {@link JoinerEvent}s on the context.
     */
    private final class PortListener implements CentralPortListener
    {
        @Override
        public void onRadioStateChanged(RadioState state)
        {
            submit(new JoinerEvent.RadioChanged(state));
        }

        @Override
        public void onPeripheralDiscovered(DeviceHandle peripheral, String advertisedName, int rssi)
        {
            submit(new JoinerEvent.PeripheralDiscovered(peripheral, advertisedName, rssi));
        }

        @Override
        public void onConnected(DeviceHandle peripheral)
        {
            submit(new JoinerEvent.Connected(peripheral));
        }

        @Override
        public void onConnectFailed(DeviceHandle peripheral, Throwable error)
        {
            submit(new JoinerEvent.ConnectFailed(peripheral, error));
        }

        @Override
        public void onServicesDiscovered(DeviceHandle peripheral, Set<UUID> services, Throwable error)
        {
            submit(new JoinerEvent.ServicesDiscovered(peripheral, services == null ? null : Set.copyOf(services), error));
        }

        @Override
        public void onChannelsDiscovered(DeviceHandle peripheral, UUID serviceId, Set<UUID> channels, Throwable error)
        {
            submit(new JoinerEvent.ChannelsDiscovered(peripheral, serviceId, channels == null ? null : Set.copyOf(channels), error));
        }

        @Override
        public void onNotifyStateChanged(DeviceHandle peripheral, UUID channel, boolean enabled, Throwable error)
        {
            submit(new JoinerEvent.NotifyStateChanged(peripheral, channel, enabled, error));
        }

        @Override
        public void onValueUpdated(DeviceHandle peripheral, UUID channel, byte[] value)
        {
            submit(new JoinerEvent.ValueUpdated(peripheral, channel, value.clone()));
        }

        @Override
        public void onDisconnected(DeviceHandle peripheral, Throwable error)
        {
            submit(new JoinerEvent.Disconnected(peripheral, error));
        }

        @Override
        public void onReadyToWrite(DeviceHandle peripheral)
        {
            submit(new JoinerEvent.ReadyToWrite(peripheral));
        }

        private void submit(JoinerEvent event)
        {
            context.execute(() -> handle(event));
        }
    }
}
