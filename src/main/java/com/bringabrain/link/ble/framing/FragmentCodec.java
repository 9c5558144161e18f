package com.bringabrain.link.ble.framing;

/**
 * FragmentCodec
 * -----------------------------------------------------------------------------
 * Byte-level codec for the 4-byte fragment header.
 *
 * <p>This class knows the wire layout and nothing else. Splitting payloads is
 * {@link PacketFramer}'s job; putting fragments back together is
 * {@link PacketReassembler}'s.</p>
 */
public final class FragmentCodec
{
    /** Header length in bytes: packetId (2), fragmentIndex (1), fragmentCount (1). */
    public static final int HEADER_SIZE = 4;

    private FragmentCodec() {}

    /**
     * Serialize a fragment to the bytes written on a channel.
     */
    public static byte[] encode(Fragment fragment)
    {
        byte[] body = fragment.payloadView();
        byte[] out = new byte[HEADER_SIZE + body.length];

        out[0] = (byte) ((fragment.packetId() >>> 8) & 0xFF);
        out[1] = (byte) (fragment.packetId() & 0xFF);
        out[2] = (byte) fragment.fragmentIndex();
        out[3] = (byte) fragment.fragmentCount();
        System.arraycopy(body, 0, out, HEADER_SIZE, body.length);

        return out;
    }

    /**
     * Parse one channel value into a fragment.
     *
     * @throws MalformedFragmentException if the value is shorter than the
     *         header, declares zero fragments, or has {@code index >= count}
     */
    public static Fragment decode(byte[] value)
            throws MalformedFragmentException
    {
        if (value == null || value.length < HEADER_SIZE) {
            throw new MalformedFragmentException("value shorter than fragment header ("
                    + (value == null ? 0 : value.length) + " bytes)");
        }

        final int packetId = ((value[0] & 0xFF) << 8) | (value[1] & 0xFF);
        final int index = value[2] & 0xFF;
        final int count = value[3] & 0xFF;

        if (count == 0) {
            throw new MalformedFragmentException("fragmentCount is zero (packetId " + packetId + ")");
        }
        if (index >= count) {
            throw new MalformedFragmentException("fragmentIndex " + index + " >= fragmentCount " + count
                    + " (packetId " + packetId + ")");
        }

        byte[] body = new byte[value.length - HEADER_SIZE];
        System.arraycopy(value, HEADER_SIZE, body, 0, body.length);
        return new Fragment(packetId, index, count, body);
    }

    /**
     * Reads just the packet id of a value, or {@code -1} if it is too short.
     */
    static int peekPacketId(byte[] value)
    {
        if (value == null || value.length < 2) {
            return -1;
        }
        return ((value[0] & 0xFF) << 8) | (value[1] & 0xFF);
    }
}
