package com.bringabrain.link.ble.peer;

import com.bringabrain.link.api.Peer;
import com.bringabrain.link.api.PeerId;
import com.bringabrain.link.ble.framing.PacketIdSequence;
import com.bringabrain.link.ble.internal.exec.FragmentPump;
import com.bringabrain.link.ble.platform.DeviceHandle;

import java.util.Objects;

/**
 * A registered peer together with the per-connection state needed to send to
 * it: its platform handle, its outbound packet id counter and its fragment
 * pump.
 */
public final class PeerLink
{
    private final Peer peer;
    private final DeviceHandle handle;
    private final PacketIdSequence packetIds = new PacketIdSequence();
    private final FragmentPump pump;

    PeerLink(Peer peer, DeviceHandle handle, FragmentPump pump) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.handle = Objects.requireNonNull(handle, "handle");
        this.pump = Objects.requireNonNull(pump, "pump");
    }

    public Peer peer() {
        return peer;
    }

    public PeerId id() {
        return peer.id();
    }

    public DeviceHandle handle() {
        return handle;
    }

    public PacketIdSequence packetIds() {
        return packetIds;
    }

    public FragmentPump pump() {
        return pump;
    }

    @Override
    public String toString() {
        return "PeerLink[" + peer.id().value() + " @ " + handle + "]";
    }
}
