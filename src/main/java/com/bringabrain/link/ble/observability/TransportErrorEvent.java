package com.bringabrain.link.ble.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the transport.
 *
 * @param cause underlying exception, may be {@code null}
 */
public record TransportErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
