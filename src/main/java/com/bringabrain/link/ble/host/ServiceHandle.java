package com.bringabrain.link.ble.host;

import com.bringabrain.link.ble.platform.ServiceLayout;

import java.util.Objects;

/**
 * Describes the service a host publishes for one advertising session.
 *
 * @param layout         service and channel identifiers
 * @param localName      host name as given by the caller; published on the info channel
 * @param advertisedName local name carried in the advertisement
 */
public record ServiceHandle(
    ServiceLayout layout,
    String localName,
    String advertisedName
) {
    public ServiceHandle {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(localName, "localName");
        Objects.requireNonNull(advertisedName, "advertisedName");
    }
}
