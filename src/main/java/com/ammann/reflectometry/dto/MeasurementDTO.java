/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.MeasurementData;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Measurement settings and raw data files")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeasurementDTO(
        @JsonProperty("instrument_settings") InstrumentSettingsDTO instrumentSettings,
        @JsonProperty("data_files") List<String> dataFiles,
        String scheme) {

    public static MeasurementDTO from(MeasurementData measurement) {
        return new MeasurementDTO(
                InstrumentSettingsDTO.from(measurement.instrumentSettings()),
                measurement.dataFiles(),
                measurement.scheme());
    }
}
