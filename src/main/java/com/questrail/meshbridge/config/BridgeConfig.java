package com.questrail.meshbridge.config;

import com.questrail.meshbridge.api.DeviceId;

import java.util.Objects;

/**
 * Aggregated configuration for the bridge state manager.
 *
 * @param aggregatorEndpointId framework endpoint under which all bridged
 *                             endpoints are created
 * @param storeNamespace       key-value namespace owned by the bridge
 * @param deviceKeyPrefix      key prefix of per-device records
 * @param globalKey            key of the global counter record
 * @param suffixLength         trailing device-id characters used as the key
 * @param labelMaxLength       maximum endpoint label length accepted by the framework
 */
public record BridgeConfig(
    int aggregatorEndpointId,
    String storeNamespace,
    String deviceKeyPrefix,
    String globalKey,
    int suffixLength,
    int labelMaxLength
) {
    public static final int MAX_ENDPOINT_ID = 0xFFFE;

    public BridgeConfig {
        if (aggregatorEndpointId < 1 || aggregatorEndpointId > MAX_ENDPOINT_ID) {
            throw new IllegalArgumentException("aggregatorEndpointId must be 1-" + MAX_ENDPOINT_ID
                + " (was " + aggregatorEndpointId + ")");
        }
        requireNonBlank(storeNamespace, "storeNamespace");
        requireNonBlank(deviceKeyPrefix, "deviceKeyPrefix");
        requireNonBlank(globalKey, "globalKey");
        if (globalKey.startsWith(deviceKeyPrefix)) {
            throw new IllegalArgumentException("globalKey must not start with deviceKeyPrefix");
        }
        if (suffixLength < 1) {
            throw new IllegalArgumentException("suffixLength must be positive");
        }
        if (labelMaxLength < 1) {
            throw new IllegalArgumentException("labelMaxLength must be positive");
        }
    }

    private static void requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int aggregatorEndpointId;
        private String storeNamespace = "bridge";
        private String deviceKeyPrefix = "tr-dev-";
        private String globalKey = "tr-global";
        private int suffixLength = DeviceId.DEFAULT_SUFFIX_LENGTH;
        private int labelMaxLength = 32;

        public Builder withAggregatorEndpointId(int aggregatorEndpointId) {
            this.aggregatorEndpointId = aggregatorEndpointId;
            return this;
        }

        public Builder withStoreNamespace(String storeNamespace) {
            this.storeNamespace = storeNamespace;
            return this;
        }

        public Builder withDeviceKeyPrefix(String deviceKeyPrefix) {
            this.deviceKeyPrefix = deviceKeyPrefix;
            return this;
        }

        public Builder withGlobalKey(String globalKey) {
            this.globalKey = globalKey;
            return this;
        }

        public Builder withSuffixLength(int suffixLength) {
            this.suffixLength = suffixLength;
            return this;
        }

        public Builder withLabelMaxLength(int labelMaxLength) {
            this.labelMaxLength = labelMaxLength;
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(aggregatorEndpointId, storeNamespace, deviceKeyPrefix,
                globalKey, suffixLength, labelMaxLength);
        }
    }
}
