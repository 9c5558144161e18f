package com.bringabrain.link.api;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test listener that records engine callbacks for assertions.
 *
 * <p>Every callback is also appended, as {@code "<callback>:<peer value>"}, to
 * an optional shared call log so tests can assert ordering against port calls.</p>
 */
public final class RecordingTransportListener implements TransportListener {

    public record Connected(PeerId peerId, String displayName) {}

    public record Received(PeerId peerId, byte[] data) {}

    private final List<String> log;
    private final List<Connected> connected = new ArrayList<>();
    private final List<PeerId> disconnected = new ArrayList<>();
    private final List<Received> received = new ArrayList<>();
    private final List<TransportError> errors = new ArrayList<>();

    public RecordingTransportListener() {
        this(new ArrayList<>());
    }

    public RecordingTransportListener(List<String> log) {
        this.log = log;
    }

    @Override
    public synchronized void onPeerConnected(PeerId peerId, String displayName) {
        connected.add(new Connected(peerId, displayName));
        log.add("onPeerConnected:" + peerId.value());
    }

    @Override
    public synchronized void onPeerDisconnected(PeerId peerId) {
        disconnected.add(peerId);
        log.add("onPeerDisconnected:" + peerId.value());
    }

    @Override
    public synchronized void onDataReceived(PeerId peerId, byte[] data) {
        received.add(new Received(peerId, data));
        log.add("onDataReceived:" + peerId.value());
    }

    @Override
    public synchronized void onTransportError(TransportError error) {
        errors.add(error);
        log.add("onTransportError:" + error.kind());
    }

    public synchronized List<Connected> connected() {
        return new ArrayList<>(connected);
    }

    public synchronized List<PeerId> connectedIds() {
        return connected.stream().map(Connected::peerId).collect(Collectors.toList());
    }

    public synchronized List<PeerId> disconnected() {
        return new ArrayList<>(disconnected);
    }

    public synchronized List<Received> received() {
        return new ArrayList<>(received);
    }

    public synchronized List<TransportError> errors() {
        return new ArrayList<>(errors);
    }

    public synchronized List<TransportErrorKind> errorKinds() {
        return errors.stream().map(TransportError::kind).collect(Collectors.toList());
    }
}
