package com.bringabrain.link.ble.framing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * PacketFramer
 * -----------------------------------------------------------------------------
 * Splits a logical message into MTU-sized fragments. Pure and side-effect
 * free; identical on host and joiner.
 *
 * <p>{@code fragmentCount = ceil(len / (mtu - 4))}, except that an empty
 * payload still yields exactly one fragment with an empty body, so empty
 * messages are representable.</p>
 *
 * <p>The MTU is a per-connection value and must be read from the connection
 * at send time. The fragment count field is one byte wide, which caps a
 * single packet at {@code 255 * (mtu - 4)} bytes.</p>
 */
public final class PacketFramer
{
    /** Smallest usable MTU: the header plus one payload byte. */
    public static final int MIN_MTU = FragmentCodec.HEADER_SIZE + 1;

    public static final int MAX_FRAGMENTS = Fragment.MAX_FRAGMENT_FIELD;

    private PacketFramer() {}

    /**
     * Split {@code payload} into fragments for a connection with the given MTU.
     *
     * @param packetId sender-assigned id from the sender's {@link PacketIdSequence}
     * @return fragments in index order
     * @throws IllegalArgumentException if {@code mtu < 5} or the payload needs
     *         more than 255 fragments at this MTU
     */
    public static List<Fragment> encode(int packetId, byte[] payload, int mtu)
    {
        Objects.requireNonNull(payload, "payload");

        final int count = fragmentCount(payload.length, mtu);
        final int slice = mtu - FragmentCodec.HEADER_SIZE;

        if (payload.length == 0) {
            return Collections.singletonList(new Fragment(packetId, 0, 1, payload));
        }

        List<Fragment> fragments = new ArrayList<>(count);
        for (int index = 0; index < count; index++) {
            int from = index * slice;
            int to = Math.min(from + slice, payload.length);
            byte[] body = new byte[to - from];
            System.arraycopy(payload, from, body, 0, body.length);
            fragments.add(new Fragment(packetId, index, count, body));
        }
        return fragments;
    }

    /**
     * Encode straight to channel values.
     */
    public static List<byte[]> encodeToWire(int packetId, byte[] payload, int mtu)
    {
        List<Fragment> fragments = encode(packetId, payload, mtu);
        List<byte[]> values = new ArrayList<>(fragments.size());
        for (Fragment fragment : fragments) {
            values.add(FragmentCodec.encode(fragment));
        }
        return values;
    }

    /**
     * Number of fragments a payload of {@code length} bytes needs at {@code mtu}.
     *
     * @throws IllegalArgumentException if {@code mtu < 5} or more than 255 fragments are needed
     */
    public static int fragmentCount(int length, int mtu)
    {
        if (mtu < MIN_MTU) {
            throw new IllegalArgumentException("MTU must be >= " + MIN_MTU + " (was " + mtu + ")");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
        if (length == 0) {
            return 1;
        }

        final int slice = mtu - FragmentCodec.HEADER_SIZE;
        final long count = ((long) length + slice - 1) / slice;
        if (count > MAX_FRAGMENTS) {
            throw new IllegalArgumentException("payload of " + length + " bytes needs " + count
                    + " fragments at MTU " + mtu + "; the limit is " + MAX_FRAGMENTS);
        }
        return (int) count;
    }

    /**
     * Largest payload a single packet can carry at {@code mtu}.
     */
    public static int maxPayloadLength(int mtu)
    {
        if (mtu < MIN_MTU) {
            throw new IllegalArgumentException("MTU must be >= " + MIN_MTU + " (was " + mtu + ")");
        }
        return MAX_FRAGMENTS * (mtu - FragmentCodec.HEADER_SIZE);
    }
}
