package com.bringabrain.link.ble.config;

import com.bringabrain.link.ble.platform.ServiceLayout;

import java.util.Objects;

/**
 * Aggregated configuration for one BLE session, host or joiner.
 *
 * @param maxPeers               joiners a host accepts at once
 * @param advertisedNamePrefix   prefix of the host's advertised local name
 * @param advertisedNameMaxLength characters of the host name kept after the prefix
 * @param localDisplayName       name a joiner announces on the info channel
 */
public record TransportConfig(
    ServiceLayout layout,
    TransportTimingPolicy timingPolicy,
    int maxPeers,
    String advertisedNamePrefix,
    int advertisedNameMaxLength,
    String localDisplayName
) {
    public static final int DEFAULT_MAX_PEERS = 4;

    public TransportConfig {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(advertisedNamePrefix, "advertisedNamePrefix");
        Objects.requireNonNull(localDisplayName, "localDisplayName");
        if (maxPeers < 1) {
            throw new IllegalArgumentException("maxPeers must be >= 1");
        }
        if (advertisedNameMaxLength < 1) {
            throw new IllegalArgumentException("advertisedNameMaxLength must be >= 1");
        }
    }

    /**
     * Local name a host advertises: the prefix plus the first
     * {@code advertisedNameMaxLength} characters of {@code hostName}.
     * A blank host name is advertised as {@code "Host"}.
     */
    public String advertisedName(String hostName) {
        String name = (hostName == null || hostName.isBlank()) ? "Host" : hostName.strip();
        if (name.length() > advertisedNameMaxLength) {
            name = name.substring(0, advertisedNameMaxLength);
        }
        return advertisedNamePrefix + name;
    }

    public static TransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServiceLayout layout = ServiceLayout.defaults();
        private TransportTimingPolicy timingPolicy = TransportTimingPolicy.defaults();
        private int maxPeers = DEFAULT_MAX_PEERS;
        private String advertisedNamePrefix = "BAB-";
        private int advertisedNameMaxLength = 8;
        private String localDisplayName = "Player";

        public Builder withLayout(ServiceLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder withTimingPolicy(TransportTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxPeers(int maxPeers) {
            this.maxPeers = maxPeers;
            return this;
        }

        public Builder withAdvertisedNamePrefix(String prefix) {
            this.advertisedNamePrefix = prefix;
            return this;
        }

        public Builder withAdvertisedNameMaxLength(int length) {
            this.advertisedNameMaxLength = length;
            return this;
        }

        public Builder withLocalDisplayName(String name) {
            this.localDisplayName = name;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(layout, timingPolicy, maxPeers,
                    advertisedNamePrefix, advertisedNameMaxLength, localDisplayName);
        }
    }
}
