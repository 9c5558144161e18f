package com.bringabrain.link.ble.framing;

/**
 * Collects the fragments of one {@code (sender, packetId)} pair.
 *
 * <p>Slots are indexed by fragment index. Writing a slot twice keeps the
 * last value, which tolerates at-least-once delivery from the platform.</p>
 */
final class ReassemblyBuffer
{
    private final int packetId;
    private final int fragmentCount;
    private final long createdAtNanos;
    private final long openOrdinal;

    private final byte[][] slots;
    private int filled;
    private int totalLength;

    ReassemblyBuffer(int packetId, int fragmentCount, long createdAtNanos, long openOrdinal) {
        this.packetId = packetId;
        this.fragmentCount = fragmentCount;
        this.createdAtNanos = createdAtNanos;
        this.openOrdinal = openOrdinal;
        this.slots = new byte[fragmentCount][];
    }

    int packetId() {
        return packetId;
    }

    int fragmentCount() {
        return fragmentCount;
    }

    long createdAtNanos() {
        return createdAtNanos;
    }

    /**
     * Position of this buffer in the sender's sequence of opened packets.
     */
    long openOrdinal() {
        return openOrdinal;
    }

    void put(int index, byte[] body) {
        byte[] previous = slots[index];
        if (previous == null) {
            filled++;
        } else {
            totalLength -= previous.length;
        }
        slots[index] = body;
        totalLength += body.length;
    }

    boolean isComplete() {
        return filled == fragmentCount;
    }

    int filledCount() {
        return filled;
    }

    /**
     * Concatenate all slots in index order. Only valid once complete.
     */
    byte[] assemble() {
        if (!isComplete()) {
            throw new IllegalStateException("buffer for packet " + packetId + " is incomplete");
        }
        byte[] out = new byte[totalLength];
        int offset = 0;
        for (byte[] slot : slots) {
            System.arraycopy(slot, 0, out, offset, slot.length);
            offset += slot.length;
        }
        return out;
    }
}
