/* (C)2026 */
package com.ammann.reflectometry.config;

/**
 * Physical corrections applied to the counts.
 *
 * @param footprint apply the two-slit footprint correction
 * @param absorption absorption coefficient source
 * @param polarisation apply polarisation-efficiency correction; not supported
 */
public record ReductionConfig(
        boolean footprint, AbsorptionCoefficient absorption, boolean polarisation) {

    public ReductionConfig {
        absorption = absorption == null ? new AbsorptionCoefficient.Disabled() : absorption;
    }

    public boolean absorptionEnabled() {
        return !(absorption instanceof AbsorptionCoefficient.Disabled);
    }
}
