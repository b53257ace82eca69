package com.questrail.meshbridge.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted global endpoint-identifier counter.
 */
public record StoredCounter(
    @JsonProperty("next_endpoint_id") int nextEndpointId
) {
}
