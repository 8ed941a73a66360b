/* (C)2026 */
package com.ammann.reflectometry.config;

public record NormalisationConfig(boolean time, boolean monitor, IntensityNormalisation intensity) {

    public NormalisationConfig {
        intensity = intensity == null ? new IntensityNormalisation.Disabled() : intensity;
    }

    public boolean intensityEnabled() {
        return !(intensity instanceof IntensityNormalisation.Disabled);
    }
}
