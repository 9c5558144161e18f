package com.bringabrain.link.ble.peer;

import com.bringabrain.link.api.Peer;
import com.bringabrain.link.api.PeerId;
import com.bringabrain.link.api.PeerRole;
import com.bringabrain.link.ble.internal.exec.FragmentPump;
import com.bringabrain.link.ble.platform.DeviceHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerRegistry
 * -----------------------------------------------------------------------------
 * Maps platform connection handles to stable logical peer identifiers.
 *
 * <p>The registry allocates a fresh {@link PeerId} for every registration, so
 * a device that reconnects becomes a new peer. Iteration follows registration
 * order.</p>
 *
 * <p>Capacity is fixed at construction: 4 on a host, 1 on a joiner.</p>
 *
 * <p>Not thread-safe. Owned by one manager and used only on its serialized
 * context.</p>
 */
public final class PeerRegistry
{
    private final int capacity;
    private final Map<DeviceHandle, PeerLink> byHandle = new LinkedHashMap<>();
    private final Map<PeerId, PeerLink> byId = new HashMap<>();

    public PeerRegistry(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Register a newly connected device.
     *
     * @throws IllegalStateException if the registry is full or the handle is already registered
     */
    public PeerLink register(DeviceHandle handle,
                             String displayName,
                             PeerRole role,
                             Instant connectedAt,
                             FragmentPump pump)
    {
        Objects.requireNonNull(handle, "handle");
        if (byHandle.containsKey(handle)) {
            throw new IllegalStateException("device " + handle + " is already registered");
        }
        if (isFull()) {
            throw new IllegalStateException("registry is full (" + capacity + " peers)");
        }

        Peer peer = new Peer(PeerId.random(), displayName, role, connectedAt);
        PeerLink link = new PeerLink(peer, handle, pump);
        byHandle.put(handle, link);
        byId.put(peer.id(), link);
        return link;
    }

    public Optional<PeerLink> byHandle(DeviceHandle handle) {
        return Optional.ofNullable(byHandle.get(handle));
    }

    public Optional<PeerLink> byId(PeerId id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(DeviceHandle handle) {
        return byHandle.containsKey(handle);
    }

    public Optional<PeerLink> remove(DeviceHandle handle) {
        PeerLink link = byHandle.remove(handle);
        if (link != null) {
            byId.remove(link.id());
        }
        return Optional.ofNullable(link);
    }

    /**
     * Remove every peer.
     *
     * @return the removed links, in registration order
     */
    public List<PeerLink> removeAll() {
        List<PeerLink> removed = new ArrayList<>(byHandle.values());
        byHandle.clear();
        byId.clear();
        return removed;
    }

    public List<PeerLink> links() {
        return Collections.unmodifiableList(new ArrayList<>(byHandle.values()));
    }

    public List<Peer> peers() {
        List<Peer> peers = new ArrayList<>(byHandle.size());
        for (PeerLink link : byHandle.values()) {
            peers.add(link.peer());
        }
        return Collections.unmodifiableList(peers);
    }

    public int size() {
        return byHandle.size();
    }

    public boolean isEmpty() {
        return byHandle.isEmpty();
    }

    public boolean isFull() {
        return byHandle.size() >= capacity;
    }

    public int capacity() {
        return capacity;
    }
}
