package com.bringabrain.link.api;

/**
 * TransportListener
 * -----------------------------------------------------------------------------
 * Engine-facing callback sink of a connection manager.
 *
 * <p>All callbacks are delivered on the owning manager's serialized execution
 * context, one at a time and never reentrantly. Implementations must return
 * quickly and must not block; hand heavy work to another executor.</p>
 *
 * <p>Byte arrays handed to {@link #onDataReceived(PeerId, byte[])} are owned
 * by the receiver. The transport keeps no reference to them.</p>
 */
public interface TransportListener
{
    /**
     * A peer is fully connected and subscribed. Raised exactly once per
     * connection.
     */
    void onPeerConnected(PeerId peerId, String displayName);

    /**
     * A peer's link was lost or closed. Raised at most once per connection,
     * and only after {@link #onPeerConnected(PeerId, String)} for that peer.
     */
    void onPeerDisconnected(PeerId peerId);

    /**
     * One fully reassembled logical message from a peer.
     */
    void onDataReceived(PeerId peerId, byte[] data);

    /**
     * A failure the presentation layer should reflect (radio prompts,
     * connection lost, capacity reached). The transport never retries on its
     * own after reporting one.
     */
    void onTransportError(TransportError error);
}
