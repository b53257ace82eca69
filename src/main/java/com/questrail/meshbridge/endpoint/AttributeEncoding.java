package com.questrail.meshbridge.endpoint;

/**
 * Conversions from mesh units to the framework's attribute encodings.
 *
 * <ul>
 *   <li>Temperature: 0.01 °C, signed 16-bit</li>
 *   <li>Relative humidity: 0.01 %RH, unsigned 16-bit</li>
 *   <li>Relay: boolean on/off</li>
 * </ul>
 *
 * Scaled values are rounded to nearest and clamped to the attribute's range.
 */
public final class AttributeEncoding
{
    private AttributeEncoding() {
    }

    public static AttributeValue.Int16 temperature(float celsius) {
        long scaled = Math.round((double) celsius * 100.0);
        return new AttributeValue.Int16((short) clamp(scaled, Short.MIN_VALUE, Short.MAX_VALUE));
    }

    public static AttributeValue.UInt16 humidity(float percent) {
        long scaled = Math.round((double) percent * 100.0);
        return new AttributeValue.UInt16((int) clamp(scaled, 0, 10_000));
    }

    public static AttributeValue.Bool relay(boolean on) {
        return new AttributeValue.Bool(on);
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }
}
