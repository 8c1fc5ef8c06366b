package com.mender.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * The slice of the triggering anomaly record this pipeline reads.
 * Everything else the detector writes is ignored.
 *
 * @param id               anomaly identifier, also used as the fix's mission reference
 * @param type             detector category (e.g. "endpoint_failure", "error_spike")
 * @param affectedEndpoint failing endpoint, when the anomaly is tied to one
 * @param description      human-readable summary from the detector
 * @param severity         detector severity, carried through for reporting
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnomalyRef(
    String id,
    String type,
    String affectedEndpoint,
    String description,
    String severity
) implements Serializable {

    public AnomalyRef(String id, String type, String affectedEndpoint) {
        this(id, type, affectedEndpoint, null, null);
    }

    public boolean hasEndpoint() {
        return affectedEndpoint != null && !affectedEndpoint.isBlank();
    }
}
