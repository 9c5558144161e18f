package com.bringabrain.link.ble.framing;

import com.bringabrain.link.api.PeerId;
import com.bringabrain.link.ble.internal.time.MonotonicClock;
import com.bringabrain.link.ble.internal.time.WallClock;
import com.bringabrain.link.ble.observability.FramingAnomalyEvent;
import com.bringabrain.link.ble.observability.TransportObservabilitySink;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PacketReassembler
 * =============================================================================
 * Rebuilds logical messages from fragments, per sender.
 *
 * <h2>Keying</h2>
 * <p>Buffers are keyed by {@code (sender, packetId)}, never by arrival order.
 * Fragments of a newer packet arriving while an older one is still open are
 * tracked independently, and fragments may arrive in any order.</p>
 *
 * <h2>Drop rules</h2>
 * <ul>
 *   <li>{@code fragmentIndex >= fragmentCount} or {@code fragmentCount == 0}:
 *       malformed, dropped, no buffer is touched</li>
 *   <li>{@code fragmentCount} differs from the open buffer's count: malformed,
 *       dropped, the open buffer is left as it is</li>
 *   <li>a fragment for a packet completed within the last reassembly timeout:
 *       duplicate, dropped, so one packet never completes twice</li>
 * </ul>
 *
 * <h2>Packet id wraparound</h2>
 * <p>Packet ids are 16 bits wide. If a sender has opened 65 535 other packets
 * since a still-open buffer was created, a fragment carrying that buffer's id
 * belongs to a new packet: the old buffer is discarded and reported. This is
 * accepted data loss, not an error.</p>
 *
 * <h2>Expiry</h2>
 * <p>Buffers older than the reassembly timeout are evicted. Eviction runs for
 * the sending peer on every accepted value and for all peers in
 * {@link #evictStale()}, which owners call periodically.</p>
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. Owned by one manager and used only on its serialized
 * context.</p>
 */
public final class PacketReassembler
{
    /** Other packets a sender must open before a still-open id counts as reused. */
    static final long WRAP_DISTANCE = Fragment.MAX_PACKET_ID;

    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final TransportObservabilitySink observabilitySink;
    private final long timeoutNanos;

    private final Map<PeerId, SenderState> senders = new HashMap<>();

    public PacketReassembler(Duration reassemblyTimeout,
                             MonotonicClock clock,
                             WallClock wallClock,
                             TransportObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(reassemblyTimeout, "reassemblyTimeout");
        if (reassemblyTimeout.isNegative() || reassemblyTimeout.isZero()) {
            throw new IllegalArgumentException("reassemblyTimeout must be positive");
        }
        this.timeoutNanos = reassemblyTimeout.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Parse a raw channel value from {@code sender} and feed it in.
     *
     * @return the complete message if this value finished one
     */
    public Optional<byte[]> accept(PeerId sender, byte[] value)
    {
        Objects.requireNonNull(sender, "sender");

        final Fragment fragment;
        try {
            fragment = FragmentCodec.decode(value);
        } catch (MalformedFragmentException e) {
            report(sender, FramingAnomalyEvent.Kind.MALFORMED_FRAGMENT, FragmentCodec.peekPacketId(value), e.getMessage());
            return Optional.empty();
        }
        return accept(sender, fragment);
    }

    /**
     * Feed one fragment from {@code sender}.
     *
     * @return the complete message if this fragment finished one
     */
    public Optional<byte[]> accept(PeerId sender, Fragment fragment)
    {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(fragment, "fragment");

        final int packetId = fragment.packetId();

        if (!fragment.isWellFormed()) {
            report(sender, FramingAnomalyEvent.Kind.MALFORMED_FRAGMENT, packetId,
                    "fragmentIndex " + fragment.fragmentIndex() + " with fragmentCount " + fragment.fragmentCount());
            return Optional.empty();
        }

        final long now = clock.nowNanos();
        SenderState state = senders.computeIfAbsent(sender, s -> new SenderState());
        evictStale(sender, state, now);

        ReassemblyBuffer buffer = state.open.get(packetId);

        if (buffer != null && state.openedSince(buffer.openOrdinal()) >= WRAP_DISTANCE) {
            state.open.remove(packetId);
            report(sender, FramingAnomalyEvent.Kind.PACKET_ID_WRAPAROUND, packetId,
                    "discarded " + buffer.filledCount() + "/" + buffer.fragmentCount() + " fragments of an earlier packet");
            buffer = null;
        }

        if (buffer == null) {
            Completed completed = state.completed.get(packetId);
            if (completed != null) {
                if (state.openedSince(completed.openOrdinal()) < WRAP_DISTANCE) {
                    report(sender, FramingAnomalyEvent.Kind.DUPLICATE_AFTER_COMPLETION, packetId,
                            "fragment " + fragment.fragmentIndex() + " re-delivered");
                    return Optional.empty();
                }
                state.completed.remove(packetId);
            }

            buffer = new ReassemblyBuffer(packetId, fragment.fragmentCount(), now, state.packetsOpened);
            state.packetsOpened++;
            state.open.put(packetId, buffer);
        }
        else if (buffer.fragmentCount() != fragment.fragmentCount()) {
            report(sender, FramingAnomalyEvent.Kind.MALFORMED_FRAGMENT, packetId,
                    "fragmentCount " + fragment.fragmentCount() + " does not match open buffer count " + buffer.fragmentCount());
            return Optional.empty();
        }

        buffer.put(fragment.fragmentIndex(), fragment.payloadView());

        if (!buffer.isComplete()) {
            return Optional.empty();
        }

        state.open.remove(packetId);
        state.completed.put(packetId, new Completed(now, buffer.openOrdinal()));
        return Optional.of(buffer.assemble());
    }

    /**
     * Discard everything held for {@code sender}. Partial messages are never
     * delivered.
     *
     * @return number of open buffers that were discarded
     */
    public int discard(PeerId sender)
    {
        SenderState state = senders.remove(sender);
        return state == null ? 0 : state.open.size();
    }

    /**
     * Discard everything held for every sender.
     */
    public void discardAll()
    {
        senders.clear();
    }

    /**
     * Evict expired buffers and completion markers for every sender.
     */
    public void evictStale()
    {
        final long now = clock.nowNanos();
        Iterator<Map.Entry<PeerId, SenderState>> it = senders.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<PeerId, SenderState> entry = it.next();
            evictStale(entry.getKey(), entry.getValue(), now);
            if (entry.getValue().isEmpty()) {
                it.remove();
            }
        }
    }

    public int openBufferCount(PeerId sender)
    {
        SenderState state = senders.get(sender);
        return state == null ? 0 : state.open.size();
    }

    public int openBufferCount()
    {
        int total = 0;
        for (SenderState state : senders.values()) {
            total += state.open.size();
        }
        return total;
    }

    private void evictStale(PeerId sender, SenderState state, long now)
    {
        Iterator<ReassemblyBuffer> open = state.open.values().iterator();
        while (open.hasNext()) {
            ReassemblyBuffer buffer = open.next();
            if (now - buffer.createdAtNanos() >= timeoutNanos) {
                open.remove();
                report(sender, FramingAnomalyEvent.Kind.STALE_BUFFER_EVICTED, buffer.packetId(),
                        buffer.filledCount() + "/" + buffer.fragmentCount() + " fragments received");
            }
        }
        state.completed.values().removeIf(c -> now - c.atNanos() >= timeoutNanos);
    }

    private void report(PeerId sender, FramingAnomalyEvent.Kind kind, int packetId, String detail)
    {
        observabilitySink.onFramingAnomaly(new FramingAnomalyEvent(wallClock.now(), sender, kind, packetId, detail));
    }

    private record Completed(long atNanos, long openOrdinal) {}

    private static final class SenderState
    {
        private final Map<Integer, ReassemblyBuffer> open = new HashMap<>();
        private final Map<Integer, Completed> completed = new HashMap<>();
        private long packetsOpened;

        /**
         * Packets opened by this sender after the one at {@code ordinal}.
         */
        long openedSince(long ordinal) {
            return packetsOpened - ordinal - 1;
        }

        boolean isEmpty() {
            return open.isEmpty() && completed.isEmpty();
        }
    }
}
