package com.bringabrain.link.ble.platform;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * ServiceLayout
 * -----------------------------------------------------------------------------
 * The fixed GATT layout shared by both roles: one advertised service and its
 * three communication channels.
 *
 * <ul>
 *   <li><b>notifyChannel</b>: host to joiner, used for unicast and broadcast;
 *       subscribing to it is what makes a joiner a peer</li>
 *   <li><b>writeChannel</b>: joiner to host</li>
 *   <li><b>infoChannel</b>: low-frequency peer metadata (display names)</li>
 * </ul>
 */
public record ServiceLayout(
        UUID serviceId,
        UUID notifyChannel,
        UUID writeChannel,
        UUID infoChannel
) {
    public static final UUID BAB_SERVICE = UUID.fromString("BAB10000-1A46-0001-0000-000000000001");
    public static final UUID BAB_GAME_STATE = UUID.fromString("BAB10000-1A46-0001-0000-000000000002");
    public static final UUID BAB_PLAYER_ACTION = UUID.fromString("BAB10000-1A46-0001-0000-000000000003");
    public static final UUID BAB_PLAYER_INFO = UUID.fromString("BAB10000-1A46-0001-0000-000000000005");

    public ServiceLayout {
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(notifyChannel, "notifyChannel");
        Objects.requireNonNull(writeChannel, "writeChannel");
        Objects.requireNonNull(infoChannel, "infoChannel");
        if (new HashSet<>(Arrays.asList(notifyChannel, writeChannel, infoChannel)).size() != 3) {
            throw new IllegalArgumentException("channel identifiers must be distinct");
        }
    }

    /**
     * The layout published by the BAB host.
     */
    public static ServiceLayout defaults() {
        return new ServiceLayout(BAB_SERVICE, BAB_GAME_STATE, BAB_PLAYER_ACTION, BAB_PLAYER_INFO);
    }

    public Set<UUID> channels() {
        return Set.of(notifyChannel, writeChannel, infoChannel);
    }
}
