package com.bringabrain.link.api;

/**
 * Taxonomy of transport failures.
 *
 * <p>Each kind carries the user-facing description the presentation layer
 * shows. Only radio-level kinds cascade across peers; everything else is
 * scoped to one peer or one connection attempt.</p>
 */
public enum TransportErrorKind
{
    RADIO_UNAVAILABLE("Bluetooth is not available. Please check that it is on and allowed in Settings."),
    CONNECTION_FAILED("Failed to connect to the host"),
    CONNECTION_TIMEOUT("Connection timed out"),
    SERVICE_NOT_FOUND("Game service not found on host"),
    CHANNEL_NOT_FOUND("Required characteristic not found"),
    CAPACITY_EXCEEDED("Maximum number of players reached"),
    MALFORMED_FRAGMENT("Received invalid data from peer"),
    PACKET_ID_WRAPAROUND("Incomplete data from peer was discarded"),
    WRITE_FAILURE("Failed to send data to peer");

    private final String description;

    TransportErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Returns {@code true} for kinds that end a connection attempt. All of
     * them are shown to the user as a generic "connection lost" state.
     */
    public boolean isConnectionFailure() {
        return this == CONNECTION_FAILED
                || this == CONNECTION_TIMEOUT
                || this == SERVICE_NOT_FOUND
                || this == CHANNEL_NOT_FOUND
                || this == CAPACITY_EXCEEDED;
    }
}
