package com.bringabrain.link.api;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable logical identifier of a connected peer, as seen by the game engine.
 *
 * <h2>Lifetime</h2>
 * <p>
 * A {@code PeerId} is allocated when a connection is established (host side:
 * when the peer's notify subscription is first observed; joiner side: when the
 * connect sequence completes) and is retired when that connection ends.
 * Identifiers are random, so a new physical connection never receives an id
 * that was used for an earlier one within the same session.
 * </p>
 *
 * <p>
 * The host and the joiner allocate their identifiers independently. The id a
 * host uses for a joiner has no relation to the id that joiner uses for the
 * host.
 * </p>
 */
public final class PeerId
{
    private final String value;

    private PeerId(String value) {
        this.value = value;
    }

    /**
     * Allocates a fresh identifier.
     */
    public static PeerId random() {
        return new PeerId(UUID.randomUUID().toString());
    }

    /**
     * Wraps an existing identifier value.
     *
     * @throws IllegalArgumentException if {@code value} is blank
     */
    public static PeerId of(String value) {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("PeerId must not be blank");
        }
        return new PeerId(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerId that)) return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PeerId[" + value + "]";
    }
}
