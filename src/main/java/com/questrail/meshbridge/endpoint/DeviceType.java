package com.questrail.meshbridge.endpoint;

import com.questrail.meshbridge.api.Capability;

import java.util.List;

/**
 * Framework device types used for bridged endpoints, one per capability.
 * <p>
 * Every bridged endpoint carries the descriptor and bridged-device basic
 * information clusters in addition to its capability cluster.
 */
public enum DeviceType
{
    ON_OFF_PLUG_IN_UNIT(0x010A, ClusterId.ON_OFF),
    TEMPERATURE_SENSOR(0x0302, ClusterId.TEMPERATURE_MEASUREMENT),
    HUMIDITY_SENSOR(0x0307, ClusterId.RELATIVE_HUMIDITY_MEASUREMENT);

    private final long id;
    private final ClusterId capabilityCluster;

    DeviceType(long id, ClusterId capabilityCluster) {
        this.id = id;
        this.capabilityCluster = capabilityCluster;
    }

    public long id() {
        return id;
    }

    public ClusterId capabilityCluster() {
        return capabilityCluster;
    }

    /**
     * Returns the server clusters an endpoint of this type must carry.
     */
    public List<ClusterId> clusters() {
        return List.of(ClusterId.DESCRIPTOR, ClusterId.BRIDGED_DEVICE_BASIC_INFORMATION, capabilityCluster);
    }

    public static DeviceType forCapability(Capability capability) {
        return switch (capability) {
            case PLUG -> ON_OFF_PLUG_IN_UNIT;
            case TEMPERATURE -> TEMPERATURE_SENSOR;
            case HUMIDITY -> HUMIDITY_SENSOR;
        };
    }
}
