package com.bringabrain.link.ble.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}. Thread-safe.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
