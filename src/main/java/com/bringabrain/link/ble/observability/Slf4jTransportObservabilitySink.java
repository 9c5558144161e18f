package com.bringabrain.link.ble.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TransportObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTransportObservabilitySink implements TransportObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTransportObservabilitySink.class);

    @Override
    public void onRadioTransition(RadioTransitionEvent event) {
        if (event.isRadioLost()) {
            log.warn("BLE radio lost: {} -> {}", event.oldState(), event.newState());
        } else {
            log.info("BLE radio: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onPeerLifecycle(PeerLifecycleEvent event) {
        switch (event.type()) {
            case CONNECTED -> log.info("Peer {} connected as {} ({})",
                event.peerId().value(), event.displayName(), event.device());
            case DISCONNECTED -> log.info("Peer {} disconnected ({})",
                event.peerId().value(), event.device());
            case REFUSED -> log.warn("Refused device {}: {}", event.device(), refusalReason(event));
        }
    }

    @Override
    public void onFramingAnomaly(FramingAnomalyEvent event) {
        log.debug("Framing anomaly from {}: {} packet={} {}",
            event.sender() != null ? event.sender().value() : "unknown",
            event.kind(),
            event.packetId(),
            event.detail());
    }

    @Override
    public void onError(TransportErrorEvent event) {
        if (event.cause() != null) {
            log.error("BLE transport error: {}", event.message(), event.cause());
        } else {
            log.warn("BLE transport error: {}", event.message());
        }
    }

    static String refusalReason(PeerLifecycleEvent event) {
        return event.detail() != null ? event.detail() : "no reason given";
    }
}
