package com.bringabrain.link.ble.joiner;

/**
 * Receives scan results from {@link JoinerConnectionManager}. Called on the
 * manager's serialized context.
 */
public interface ScanListener
{
    /**
     * A host not seen before in this scan. Each platform identifier is
     * reported at most once per scan.
     */
    void onHostDiscovered(DiscoveredHost host);

    /**
     * The scan ended: its duration elapsed, it was stopped, a connection was
     * started, or the radio was lost.
     */
    default void onScanFinished() {
    }
}
