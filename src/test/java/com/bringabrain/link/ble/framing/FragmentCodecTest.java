package com.bringabrain.link.ble.framing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FragmentCodecTest
{
    // ---------------------------------------------------------------------
    // Header layout
    // ---------------------------------------------------------------------

    /**
     * Verifies the 4-byte header: packetId big-endian, then index, then count,
     * followed by the body unchanged.
     */
    @Test
    void encodesHeaderBigEndianFollowedByBody()
    {
        Fragment fragment = new Fragment(0x1234, 2, 7, new byte[] { 0x0A, 0x0B });

        byte[] value = FragmentCodec.encode(fragment);

        assertArrayEquals(new byte[] { 0x12, 0x34, 0x02, 0x07, 0x0A, 0x0B }, value);
    }

    @Test
    void decodesUnsignedHeaderFields() throws MalformedFragmentException
    {
        byte[] value = { (byte) 0xFF, (byte) 0xFE, (byte) 0xFD, (byte) 0xFE, 0x55 };

        Fragment fragment = FragmentCodec.decode(value);

        assertEquals(0xFFFE, fragment.packetId());
        assertEquals(0xFD, fragment.fragmentIndex());
        assertEquals(0xFE, fragment.fragmentCount());
        assertArrayEquals(new byte[] { 0x55 }, fragment.payload());
    }

    @Test
    void headerOnlyValueDecodesToEmptyBody() throws MalformedFragmentException
    {
        Fragment fragment = FragmentCodec.decode(new byte[] { 0, 9, 0, 1 });

        assertEquals(9, fragment.packetId());
        assertEquals(0, fragment.payloadLength());
    }

    // ---------------------------------------------------------------------
    // Malformed values
    // ---------------------------------------------------------------------

    @Test
    void rejectsValueShorterThanHeader()
    {
        assertThrows(MalformedFragmentException.class, () -> FragmentCodec.decode(new byte[] { 0, 1, 0 }));
        assertThrows(MalformedFragmentException.class, () -> FragmentCodec.decode(new byte[0]));
    }

    @Test
    void rejectsZeroFragmentCount()
    {
        assertThrows(MalformedFragmentException.class, () -> FragmentCodec.decode(new byte[] { 0, 1, 0, 0, 42 }));
    }

    @Test
    void rejectsIndexNotBelowCount()
    {
        MalformedFragmentException e = assertThrows(MalformedFragmentException.class,
                () -> FragmentCodec.decode(new byte[] { 0, 1, 3, 3 }));
        assertTrue(e.getMessage().contains("fragmentIndex 3"));
    }

    @Test
    void fragmentRejectsOutOfRangeFields()
    {
        assertThrows(IllegalArgumentException.class, () -> new Fragment(0x10000, 0, 1, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new Fragment(1, 256, 1, new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> new Fragment(1, 0, -1, new byte[0]));
    }

    @Test
    void fragmentCopiesPayload()
    {
        byte[] body = { 1, 2, 3 };
        Fragment fragment = new Fragment(1, 0, 1, body);
        body[0] = 99;

        assertEquals(1, fragment.payload()[0]);
        fragment.payload()[1] = 99;
        assertEquals(2, fragment.payload()[1]);
    }
}
