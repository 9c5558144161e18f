package com.bringabrain.link.ble.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for peer connection stamps and observability events.
 *
 * <p>This clock may jump (NTP, manual changes). It MUST NOT be used to decide
 * timeouts or buffer expiry; use {@link MonotonicClock} for that.</p>
 */
public interface WallClock
{
    Instant now();
}
