/**
 * Packet Framing
 * =============================================================================
 *
 * <p>Splits logical messages into fragments that fit one channel value and
 * reassembles them on the receiving side. The same code runs on host and
 * joiner, so both roles agree on one wire format.</p>
 *
 * <h2>Placement</h2>
 * <pre>
 *   outbound:  payload → PacketFramer → Fragment → FragmentCodec → channel value
 *   inbound:   channel value → FragmentCodec → Fragment → PacketReassembler → payload
 * </pre>
 *
 * <p>This layer is transport-agnostic and knows nothing about peers beyond
 * the {@link com.bringabrain.link.api.PeerId} that keys reassembly. Any
 * inconsistency in a fragment results in that fragment being dropped.</p>
 */
package com.bringabrain.link.ble.framing;
