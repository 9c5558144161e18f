package com.bringabrain.link.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable description of one connected peer.
 *
 * <p>Owned by the peer registry of the device that observed the connection.</p>
 */
public record Peer(
        PeerId id,
        String displayName,
        PeerRole role,
        Instant connectedAt
) {
    public Peer {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(connectedAt, "connectedAt");
    }
}
