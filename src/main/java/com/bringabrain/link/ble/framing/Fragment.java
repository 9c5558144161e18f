package com.bringabrain.link.ble.framing;

/**
 * Fragment
 * -----------------------------------------------------------------------------
 * One wire unit of a packet: a 4-byte header plus a slice of the payload.
 *
 * <pre>
 *   byte 0..1 : packetId       (u16, big-endian)
 *   byte 2    : fragmentIndex  (u8)
 *   byte 3    : fragmentCount  (u8)
 *   byte 4..N : payload slice  (at most MTU - 4 bytes)
 * </pre>
 *
 * <p>The constructor enforces field widths only. The relation between index
 * and count ({@code fragmentIndex < fragmentCount}, {@code fragmentCount >= 1})
 * is checked by the reassembler, so a malformed header received from a peer
 * can still be represented and rejected there.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class Fragment
{
    public static final int MAX_PACKET_ID = 0xFFFF;
    public static final int MAX_FRAGMENT_FIELD = 0xFF;

    private final int packetId;
    private final int fragmentIndex;
    private final int fragmentCount;
    private final byte[] payload;

    public Fragment(int packetId, int fragmentIndex, int fragmentCount, byte[] payload) {
        if (packetId < 0 || packetId > MAX_PACKET_ID) {
            throw new IllegalArgumentException("packetId must be 0-65535 (was " + packetId + ")");
        }
        if (fragmentIndex < 0 || fragmentIndex > MAX_FRAGMENT_FIELD) {
            throw new IllegalArgumentException("fragmentIndex must be 0-255 (was " + fragmentIndex + ")");
        }
        if (fragmentCount < 0 || fragmentCount > MAX_FRAGMENT_FIELD) {
            throw new IllegalArgumentException("fragmentCount must be 0-255 (was " + fragmentCount + ")");
        }
        this.packetId = packetId;
        this.fragmentIndex = fragmentIndex;
        this.fragmentCount = fragmentCount;
        this.payload = (payload == null) ? new byte[0] : payload.clone();
    }

    public int packetId() {
        return packetId;
    }

    public int fragmentIndex() {
        return fragmentIndex;
    }

    public int fragmentCount() {
        return fragmentCount;
    }

    /**
     * Returns a copy of the payload slice.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    /**
     * True if the header is internally consistent.
     */
    public boolean isWellFormed() {
        return fragmentCount >= 1 && fragmentIndex < fragmentCount;
    }

    // Package-private: the reassembler copies slices once into its own buffer.
    byte[] payloadView() {
        return payload;
    }

    @Override
    public String toString() {
        return "Fragment[" +
                "packetId=" + packetId +
                ", index=" + fragmentIndex +
                "/" + fragmentCount +
                ", payloadLength=" + payload.length +
                ']';
    }
}
