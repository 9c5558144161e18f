package com.bringabrain.link.ble.observability;

/**
 * No-op implementation of TransportObservabilitySink.
 */
public final class NullObservabilitySink implements TransportObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRadioTransition(RadioTransitionEvent event) {}

    @Override
    public void onPeerLifecycle(PeerLifecycleEvent event) {}

    @Override
    public void onFramingAnomaly(FramingAnomalyEvent event) {}

    @Override
    public void onError(TransportErrorEvent event) {}
}
