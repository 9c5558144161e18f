package com.bringabrain.link.ble.config;

import java.time.Duration;
import java.util.Objects;

/**
 * TransportTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the connection managers.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>interFragmentDelay</b>: Spacing between consecutive fragment writes
 *       on one link. Keeps the local radio's outgoing buffer from overrunning.
 *       Reassembly never depends on it.</li>
 *   <li><b>connectionTimeout</b>: Upper bound on a joiner's
 *       connect/discover/subscribe sequence. Expiry is a terminal
 *       {@code CONNECTION_TIMEOUT}.</li>
 *   <li><b>scanDuration</b>: Default scan window when the caller gives none.</li>
 *   <li><b>reassemblyTimeout</b>: Age after which an incomplete reassembly
 *       buffer is discarded, and how long completed packet ids are remembered
 *       for duplicate suppression.</li>
 *   <li><b>busyRetryDelay</b>: Retry spacing when the platform refuses a write
 *       because its queue is full and no readiness signal arrives first.</li>
 * </ul>
 */
public record TransportTimingPolicy(
        Duration interFragmentDelay,
        Duration connectionTimeout,
        Duration scanDuration,
        Duration reassemblyTimeout,
        Duration busyRetryDelay
) {
    public TransportTimingPolicy {
        Objects.requireNonNull(interFragmentDelay, "interFragmentDelay");
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(scanDuration, "scanDuration");
        Objects.requireNonNull(reassemblyTimeout, "reassemblyTimeout");
        Objects.requireNonNull(busyRetryDelay, "busyRetryDelay");

        if (interFragmentDelay.isNegative()) {
            throw new IllegalArgumentException("interFragmentDelay must be non-negative");
        }
        if (connectionTimeout.isNegative() || connectionTimeout.isZero()) {
            throw new IllegalArgumentException("connectionTimeout must be positive");
        }
        if (scanDuration.isNegative() || scanDuration.isZero()) {
            throw new IllegalArgumentException("scanDuration must be positive");
        }
        if (reassemblyTimeout.isNegative() || reassemblyTimeout.isZero()) {
            throw new IllegalArgumentException("reassemblyTimeout must be positive");
        }
        if (busyRetryDelay.isNegative()) {
            throw new IllegalArgumentException("busyRetryDelay must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>interFragmentDelay: 10ms</li>
     *   <li>connectionTimeout: 30s</li>
     *   <li>scanDuration: 15s</li>
     *   <li>reassemblyTimeout: 30s</li>
     *   <li>busyRetryDelay: 20ms</li>
     * </ul>
     */
    public static TransportTimingPolicy defaults() {
        return new TransportTimingPolicy(
                Duration.ofMillis(10),
                Duration.ofSeconds(30),
                Duration.ofSeconds(15),
                Duration.ofSeconds(30),
                Duration.ofMillis(20)
        );
    }

    /**
     * Copy with a different fragment spacing.
     */
    public TransportTimingPolicy withInterFragmentDelay(Duration delay) {
        return new TransportTimingPolicy(delay, connectionTimeout, scanDuration, reassemblyTimeout, busyRetryDelay);
    }

    /**
     * Interval of the periodic stale-buffer sweep.
     */
    public Duration sweepInterval() {
        return reassemblyTimeout.dividedBy(2);
    }
}
