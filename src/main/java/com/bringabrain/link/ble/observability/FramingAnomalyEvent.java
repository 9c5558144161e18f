package com.bringabrain.link.ble.observability;

import com.bringabrain.link.api.PeerId;

import java.time.Instant;

/**
 * Record of data dropped from one sender's fragment stream.
 *
 * <p>These never abort the manager and never affect other senders.</p>
 *
 * @param packetId packet id the anomaly concerns, or {@code -1} if the header was unreadable
 */
public record FramingAnomalyEvent(
    Instant timestamp,
    PeerId sender,
    Kind kind,
    int packetId,
    String detail
) {
    public enum Kind {
        /** Header fields inconsistent; the fragment was dropped. */
        MALFORMED_FRAGMENT,
        /** An open buffer was replaced by a newer packet reusing its id. */
        PACKET_ID_WRAPAROUND,
        /** A buffer outlived the reassembly timeout and was discarded. */
        STALE_BUFFER_EVICTED,
        /** A fragment arrived for a packet that was already delivered. */
        DUPLICATE_AFTER_COMPLETION
    }
}
