package com.questrail.meshbridge.endpoint;

/**
 * Attributes the bridge reads or writes, each qualified by its cluster.
 */
public enum AttributeId
{
    ON_OFF(ClusterId.ON_OFF, 0x0000),
    TEMPERATURE_MEASURED_VALUE(ClusterId.TEMPERATURE_MEASUREMENT, 0x0000),
    HUMIDITY_MEASURED_VALUE(ClusterId.RELATIVE_HUMIDITY_MEASUREMENT, 0x0000);

    private final ClusterId cluster;
    private final long id;

    AttributeId(ClusterId cluster, long id) {
        this.cluster = cluster;
        this.id = id;
    }

    public ClusterId cluster() {
        return cluster;
    }

    public long id() {
        return id;
    }

    /**
     * Returns {@code true} if the raw cluster/attribute pair denotes this attribute.
     */
    public boolean matches(long clusterId, long attributeId) {
        return cluster.id() == clusterId && id == attributeId;
    }
}
