package com.bringabrain.link.ble.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every transport timing decision: connection timeouts, scan
 * windows, fragment pacing and reassembly expiry.
 *
 * <p>Wall-clock time is only used for the {@code connectedAt} stamp of a peer
 * and for observability events. It never decides whether a buffer is stale.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful relative to each other.
     */
    long nowNanos();
}
