package com.bringabrain.link.ble.framing;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

final class PacketFramerTest
{
    private static byte[] randomBytes(int length, long seed)
    {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        return data;
    }

    @Test
    void tenThousandBytesAtMtu185NeedFiftySixFragments()
    {
        byte[] payload = randomBytes(10_000, 1);

        List<Fragment> fragments = PacketFramer.encode(7, payload, 185);

        assertEquals(56, fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            Fragment f = fragments.get(i);
            assertEquals(7, f.packetId());
            assertEquals(i, f.fragmentIndex());
            assertEquals(56, f.fragmentCount());
        }
        assertEquals(181, fragments.get(0).payloadLength());
        assertEquals(10_000 - 55 * 181, fragments.get(55).payloadLength());

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (Fragment f : fragments) {
            joined.writeBytes(f.payload());
        }
        assertArrayEquals(payload, joined.toByteArray());
    }

    @Test
    void emptyPayloadYieldsOneEmptyFragment()
    {
        List<Fragment> fragments = PacketFramer.encode(3, new byte[0], 23);

        assertEquals(1, fragments.size());
        assertEquals(0, fragments.get(0).fragmentIndex());
        assertEquals(1, fragments.get(0).fragmentCount());
        assertEquals(0, fragments.get(0).payloadLength());
    }

    @Test
    void payloadThatFillsSlicesExactlyHasNoTrailingEmptyFragment()
    {
        List<Fragment> fragments = PacketFramer.encode(0, new byte[19 * 3], 23);

        assertEquals(3, fragments.size());
        assertEquals(19, fragments.get(2).payloadLength());
    }

    @Test
    void wireValuesNeverExceedMtu()
    {
        List<byte[]> values = PacketFramer.encodeToWire(1, randomBytes(1000, 2), 23);

        assertEquals(53, values.size());
        for (byte[] value : values) {
            assertTrue(value.length <= 23);
        }
    }

    @Test
    void rejectsMtuWithoutRoomForPayload()
    {
        assertThrows(IllegalArgumentException.class, () -> PacketFramer.encode(1, new byte[1], 4));
        assertEquals(1, PacketFramer.fragmentCount(1, PacketFramer.MIN_MTU));
    }

    @Test
    void rejectsPayloadNeedingMoreThan255Fragments()
    {
        int max = PacketFramer.maxPayloadLength(23);
        assertEquals(255 * 19, max);
        assertEquals(255, PacketFramer.encode(1, new byte[max], 23).size());

        assertThrows(IllegalArgumentException.class, () -> PacketFramer.encode(1, new byte[max + 1], 23));
    }

    @Test
    void packetIdSequenceWrapsAt65536()
    {
        PacketIdSequence ids = new PacketIdSequence(0xFFFE);

        assertEquals(0xFFFE, ids.next());
        assertEquals(0xFFFF, ids.next());
        assertEquals(0, ids.next());
        assertEquals(1, ids.peek());
    }
}
