package com.bringabrain.link.api;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Packet
 * -----------------------------------------------------------------------------
 * The unit of data exchanged with the game engine: an opaque payload and an
 * optional target peer.
 *
 * <p>A packet without a target is a broadcast. Broadcast only has meaning on
 * the host; a joiner has exactly one peer and ignores the target.</p>
 *
 * <p>This is not a wire format. The framing layer splits a packet's payload
 * into MTU-sized fragments per connection.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class Packet
{
    private final PeerId targetPeerId;
    private final byte[] payload;

    private Packet(PeerId targetPeerId, byte[] payload) {
        this.targetPeerId = targetPeerId;
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    /**
     * A packet for every connected peer.
     */
    public static Packet broadcast(byte[] payload) {
        return new Packet(null, payload);
    }

    /**
     * A packet for one peer.
     */
    public static Packet to(PeerId target, byte[] payload) {
        return new Packet(Objects.requireNonNull(target, "target"), payload);
    }

    /**
     * Returns the target peer, or empty for a broadcast.
     */
    public Optional<PeerId> targetPeerId() {
        return Optional.ofNullable(targetPeerId);
    }

    public boolean isBroadcast() {
        return targetPeerId == null;
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Packet that)) return false;
        return Objects.equals(targetPeerId, that.targetPeerId) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(targetPeerId) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Packet[" +
                "target=" + (targetPeerId == null ? "broadcast" : targetPeerId.value()) +
                ", payloadLength=" + payload.length +
                ']';
    }
}
