package com.aegis.allocation.service;

import io.quarkus.test.junit.QuarkusTestProfile;

import java.util.Map;

public class FastTrackEnabledProfile implements QuarkusTestProfile {

    @Override
    public Map<String, String> getConfigOverrides() {
        return Map.of("aegis.fast-track.enabled", "true");
    }
}
