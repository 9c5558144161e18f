package com.bringabrain.link.api;

import java.util.Objects;
import java.util.Optional;

/**
 * A failure surfaced to the engine through
 * {@link TransportListener#onTransportError(TransportError)}.
 *
 * @param kind   failure classification
 * @param peerId affected peer, or {@code null} when the failure is not tied to one
 * @param detail diagnostic text for logs; not meant for end users
 */
public record TransportError(
        TransportErrorKind kind,
        PeerId peerId,
        String detail
) {
    public TransportError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public static TransportError of(TransportErrorKind kind, String detail) {
        return new TransportError(kind, null, detail);
    }

    public Optional<PeerId> peer() {
        return Optional.ofNullable(peerId);
    }
}
