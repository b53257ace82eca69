package com.questrail.meshbridge.endpoint;

/**
 * Framework clusters the bridge creates or touches, with their numeric
 * identifiers in the smart-home data model.
 */
public enum ClusterId
{
    ON_OFF(0x0006),
    DESCRIPTOR(0x001D),
    BRIDGED_DEVICE_BASIC_INFORMATION(0x0039),
    TEMPERATURE_MEASUREMENT(0x0402),
    RELATIVE_HUMIDITY_MEASUREMENT(0x0405);

    private final long id;

    ClusterId(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }
}
