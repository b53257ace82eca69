package com.questrail.meshbridge.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted projection of one bridged device.
 *
 * <p>Endpoint identifiers of {@code 0} mean "not yet created". Each optional
 * value is paired with a {@code has_*} flag; the value field is meaningless
 * when its flag is {@code false}.</p>
 */
public record StoredDevice(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("plug_endpoint_id") int plugEndpointId,
    @JsonProperty("temp_endpoint_id") int tempEndpointId,
    @JsonProperty("humidity_endpoint_id") int humidityEndpointId,
    @JsonProperty("has_temperature") boolean hasTemperature,
    @JsonProperty("temperature") float temperature,
    @JsonProperty("has_humidity") boolean hasHumidity,
    @JsonProperty("humidity") float humidity,
    @JsonProperty("has_relay_state") boolean hasRelayState,
    @JsonProperty("relay_state") boolean relayState
) {
}
