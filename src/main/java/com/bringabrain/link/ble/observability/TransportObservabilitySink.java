package com.bringabrain.link.ble.observability;

/**
 * Receives transport observability events. Implementations can provide
 * logging, metrics, or tracing.
 *
 * <p>Events are delivered on the reporting manager's serialized context.</p>
 */
public interface TransportObservabilitySink {
    /**
     * Called when the local radio changes state.
     */
    void onRadioTransition(RadioTransitionEvent event);

    /**
     * Called when a peer connects, disconnects, or is refused.
     */
    void onPeerLifecycle(PeerLifecycleEvent event);

    /**
     * Called when the reassembler drops, discards, or evicts data from one
     * sender's stream.
     */
    void onFramingAnomaly(FramingAnomalyEvent event);

    /**
     * Called when an error or anomaly occurs outside a single fragment stream.
     */
    void onError(TransportErrorEvent event);
}
