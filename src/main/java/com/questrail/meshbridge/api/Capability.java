package com.questrail.meshbridge.api;

/**
 * Capability
 * -----------------------------------------------------------------------------
 * One sensor or actuator facet a mesh device may expose.
 *
 * <h2>Semantics</h2>
 * A device exposes any non-empty subset of capabilities, and that subset may
 * grow over the device's lifetime (for example after a firmware upgrade adds a
 * sensor). The bridge therefore never enumerates "device types"; it tracks one
 * bridged endpoint per capability and creates each lazily, the first time a
 * report carries a value for it.
 *
 * <h2>Naming</h2>
 * {@link #label()} is the lower-case name used in endpoint labels and logs.
 * It is descriptive only and must not be used to infer behavior.
 */
public enum Capability
{
    /**
     * A switchable relay, bridged as an on/off plug-in unit.
     */
    PLUG("plug"),

    /**
     * An ambient temperature sensor (degrees Celsius).
     */
    TEMPERATURE("temperature"),

    /**
     * A relative humidity sensor (percent RH).
     */
    HUMIDITY("humidity");

    private final String label;

    Capability(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
