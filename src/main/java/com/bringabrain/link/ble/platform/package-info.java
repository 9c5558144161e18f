/**
 * BLE Platform Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * BLE stack (CoreBluetooth, {@code android.bluetooth}, a simulator or a test
 * double) and the connection managers.
 *
 * <h2>Why these ports exist</h2>
 * The managers must be testable and portable without pulling any platform SDK
 * into this library. Everything above a port sees only:
 * <ul>
 *   <li>opaque {@link com.bringabrain.link.ble.platform.DeviceHandle}s</li>
 *   <li>channel identifiers as {@link java.util.UUID}</li>
 *   <li>raw channel values as {@code byte[]}</li>
 *   <li>radio state and link lifecycle notifications</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * Port implementations MUST:
 * <ul>
 *   <li>perform radio I/O only, with no fragmentation or reassembly</li>
 *   <li>deliver values exactly as received, one channel value per callback</li>
 *   <li>not schedule retries or timeouts of their own</li>
 * </ul>
 *
 * <p>Callbacks may arrive on any platform thread. The managers funnel them
 * into their own serialized context before touching any state.</p>
 */
package com.bringabrain.link.ble.platform;
