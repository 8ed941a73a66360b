/* (C)2026 */
package com.ammann.reflectometry.model;

import java.util.List;

public record MeasurementData(
        InstrumentSettings instrumentSettings, List<String> dataFiles, String scheme) {

    public MeasurementData {
        dataFiles = dataFiles == null ? List.of() : List.copyOf(dataFiles);
        scheme = scheme == null ? "angle-dispersive" : scheme;
    }

    public MeasurementData(InstrumentSettings instrumentSettings, String dataFile) {
        this(instrumentSettings, dataFile == null ? List.of() : List.of(dataFile), null);
    }
}
