package com.bringabrain.link.ble.framing;

/**
 * Per-peer outbound packet id counter. Wraps from 65535 back to 0.
 *
 * <p>Not thread-safe; owned by one link on one serialized context.</p>
 */
public final class PacketIdSequence
{
    private int next;

    public PacketIdSequence() {
        this(0);
    }

    public PacketIdSequence(int first) {
        if (first < 0 || first > Fragment.MAX_PACKET_ID) {
            throw new IllegalArgumentException("first must be 0-65535 (was " + first + ")");
        }
        this.next = first;
    }

    /**
     * Returns the next id and advances the counter.
     */
    public int next() {
        int id = next;
        next = (next + 1) & Fragment.MAX_PACKET_ID;
        return id;
    }

    public int peek() {
        return next;
    }
}
