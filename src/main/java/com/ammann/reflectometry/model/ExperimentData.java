/* (C)2026 */
package com.ammann.reflectometry.model;

import com.ammann.reflectometry.properties.InstrumentProperties;
import java.time.LocalDateTime;

/**
 * Experiment provenance shared by every channel of one measurement file.
 */
public record ExperimentData(
        String title,
        String instrument,
        LocalDateTime startDate,
        String proposalId,
        String doi,
        String probe,
        String facility) {

    public ExperimentData {
        probe = probe == null ? "neutron" : probe;
        facility = facility == null ? InstrumentProperties.FACILITY : facility;
    }
}
