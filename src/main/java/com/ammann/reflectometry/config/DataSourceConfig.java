/* (C)2026 */
package com.ammann.reflectometry.config;

import com.ammann.reflectometry.model.RegionOfInterest;
import com.ammann.reflectometry.properties.InstrumentProperties;

/**
 * Detector the signal is read from.
 *
 * @param detector detector or channel name as listed by the metadata provider
 * @param region signal region, required for the area detector and {@code null} otherwise
 */
public record DataSourceConfig(String detector, RegionOfInterest region) {

    public boolean isAreaDetector() {
        return InstrumentProperties.AREA_DETECTOR.equals(detector);
    }
}
