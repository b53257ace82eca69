package com.questrail.meshbridge.api;

import java.util.Objects;
import java.util.Optional;

/**
 * LastKnownValues
 * -----------------------------------------------------------------------------
 * The cumulative "last-known" sensor and actuator values of one device.
 *
 * <h2>Sticky merge</h2>
 * Each value is absent until first observed. Once observed it is sticky: a
 * later report that does not carry the value leaves it unchanged, and nothing
 * in the bridge ever reverts it to absent. A report that does carry the value
 * overwrites it unconditionally.
 *
 * <p>There is no staleness or expiry policy; a value observed once remains the
 * last-known value for as long as the device record exists.</p>
 *
 * <p>Instances are immutable; {@link #merge(MeshReport)} returns a new one.</p>
 */
public final class LastKnownValues
{
    private static final LastKnownValues EMPTY = new LastKnownValues(null, null, null);

    private final Float temperature;
    private final Float humidity;
    private final Boolean relayState;

    private LastKnownValues(Float temperature, Float humidity, Boolean relayState) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.relayState = relayState;
    }

    public static LastKnownValues empty() {
        return EMPTY;
    }

    /**
     * Rebuilds values from their persisted projection.
     */
    public static LastKnownValues of(Optional<Float> temperature,
                                     Optional<Float> humidity,
                                     Optional<Boolean> relayState) {
        return new LastKnownValues(
                temperature.orElse(null),
                humidity.orElse(null),
                relayState.orElse(null));
    }

    public Optional<Float> temperature() {
        return Optional.ofNullable(temperature);
    }

    public Optional<Float> humidity() {
        return Optional.ofNullable(humidity);
    }

    public Optional<Boolean> relayState() {
        return Optional.ofNullable(relayState);
    }

    /**
     * Applies every value present in {@code report}; absent values keep their
     * prior state.
     */
    public LastKnownValues merge(MeshReport report) {
        Objects.requireNonNull(report, "report");
        return new LastKnownValues(
                report.temperature().orElse(temperature),
                report.humidity().orElse(humidity),
                report.relayState().orElse(relayState));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LastKnownValues that)) return false;
        return Objects.equals(temperature, that.temperature)
                && Objects.equals(humidity, that.humidity)
                && Objects.equals(relayState, that.relayState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(temperature, humidity, relayState);
    }

    @Override
    public String toString() {
        return "LastKnownValues[temperature=" + temperature
                + ", humidity=" + humidity
                + ", relay=" + relayState + "]";
    }
}
