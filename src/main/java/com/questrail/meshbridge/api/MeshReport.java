package com.questrail.meshbridge.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MeshReport
 * -----------------------------------------------------------------------------
 * A decoded, capability-tagged snapshot of one device's sensor and actuator
 * values, as delivered by the mesh transport.
 *
 * <h2>Partial by nature</h2>
 * A report carries only the values the device chose to send. A capability that
 * is absent from a report is <b>unspecified</b>, not "unknown": it must never
 * clear a previously observed value. This mirrors the merge rule used for
 * last-known state in the registry.
 *
 * <h2>Raw identity</h2>
 * The device identifier is carried exactly as received. Validation into a
 * {@link DeviceId} happens in the reconciliation engine, which is where a
 * malformed identity is detected, reported and dropped.
 *
 * <p>Instances are immutable.</p>
 */
public final class MeshReport
{
    private final String deviceId;
    private final Float temperature;
    private final Float humidity;
    private final Boolean relayState;

    private MeshReport(String deviceId, Float temperature, Float humidity, Boolean relayState) {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.temperature = temperature;
        this.humidity = humidity;
        this.relayState = relayState;
    }

    public static Builder builder(String deviceId) {
        return new Builder(deviceId);
    }

    /**
     * Returns the device identifier exactly as reported.
     */
    public String deviceId() {
        return deviceId;
    }

    /**
     * Temperature in degrees Celsius, if reported.
     */
    public Optional<Float> temperature() {
        return Optional.ofNullable(temperature);
    }

    /**
     * Relative humidity in percent, if reported.
     */
    public Optional<Float> humidity() {
        return Optional.ofNullable(humidity);
    }

    /**
     * Relay state ({@code true} = on), if reported.
     */
    public Optional<Boolean> relayState() {
        return Optional.ofNullable(relayState);
    }

    /**
     * Returns the capabilities for which this report carries a value.
     */
    public Set<Capability> capabilities() {
        EnumSet<Capability> present = EnumSet.noneOf(Capability.class);
        if (relayState != null) {
            present.add(Capability.PLUG);
        }
        if (temperature != null) {
            present.add(Capability.TEMPERATURE);
        }
        if (humidity != null) {
            present.add(Capability.HUMIDITY);
        }
        return Collections.unmodifiableSet(present);
    }

    /**
     * Returns {@code true} if the report carries no values at all.
     */
    public boolean isEmpty() {
        return temperature == null && humidity == null && relayState == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeshReport that)) return false;
        return deviceId.equals(that.deviceId)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(humidity, that.humidity)
                && Objects.equals(relayState, that.relayState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId, temperature, humidity, relayState);
    }

    @Override
    public String toString() {
        return "MeshReport[" + deviceId
                + ", temperature=" + (temperature != null ? temperature : "-")
                + ", humidity=" + (humidity != null ? humidity : "-")
                + ", relay=" + (relayState != null ? (relayState ? "ON" : "OFF") : "-")
                + "]";
    }

    public static final class Builder
    {
        private final String deviceId;
        private Float temperature;
        private Float humidity;
        private Boolean relayState;

        private Builder(String deviceId) {
            this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        }

        public Builder temperature(float celsius) {
            if (Float.isNaN(celsius)) {
                throw new IllegalArgumentException("temperature must not be NaN");
            }
            this.temperature = celsius;
            return this;
        }

        public Builder humidity(float percent) {
            if (Float.isNaN(percent)) {
                throw new IllegalArgumentException("humidity must not be NaN");
            }
            this.humidity = percent;
            return this;
        }

        public Builder relayState(boolean on) {
            this.relayState = on;
            return this;
        }

        public MeshReport build() {
            return new MeshReport(deviceId, temperature, humidity, relayState);
        }
    }
}
