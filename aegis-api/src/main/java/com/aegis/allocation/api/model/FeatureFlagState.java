package com.aegis.allocation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Process-wide feature flags, read once at startup and passed explicitly to
 * the components that consult them.
 *
 * @param fastTrackEnabled whether eligible submissions may take the
 *                         Fast-Track template baseline
 */
public record FeatureFlagState(
    @JsonProperty("fast_track_enabled") boolean fastTrackEnabled
) implements Serializable {

    private static final FeatureFlagState DISABLED = new FeatureFlagState(false);
    private static final FeatureFlagState FAST_TRACK = new FeatureFlagState(true);

    public static FeatureFlagState disabled() {
        return DISABLED;
    }

    public static FeatureFlagState withFastTrack() {
        return FAST_TRACK;
    }
}
