package com.bringabrain.link.ble.observability;

import com.bringabrain.link.api.PeerId;

import java.time.Instant;

/**
 * Record of a peer lifecycle step.
 *
 * @param peerId       logical id, or {@code null} for a refused device that never became a peer
 * @param device       platform handle value of the remote device
 * @param displayName  peer name, or {@code null} for a refused device
 * @param detail       why the device was refused; {@code null} for other steps
 */
public record PeerLifecycleEvent(
    Instant timestamp,
    Type type,
    PeerId peerId,
    String device,
    String displayName,
    String detail
) {
    public static PeerLifecycleEvent connected(Instant timestamp, PeerId peerId, String device, String displayName) {
        return new PeerLifecycleEvent(timestamp, Type.CONNECTED, peerId, device, displayName, null);
    }

    public static PeerLifecycleEvent disconnected(Instant timestamp, PeerId peerId, String device, String displayName) {
        return new PeerLifecycleEvent(timestamp, Type.DISCONNECTED, peerId, device, displayName, null);
    }

    public static PeerLifecycleEvent refused(Instant timestamp, String device, String reason) {
        return new PeerLifecycleEvent(timestamp, Type.REFUSED, null, device, null, reason);
    }

    public enum Type {
        CONNECTED,
        DISCONNECTED,
        REFUSED
    }
}
