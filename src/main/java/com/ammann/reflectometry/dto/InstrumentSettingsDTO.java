/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.PolarizationEfficiency;
import com.ammann.reflectometry.model.SlitData;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Instrument settings of one polarization channel")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InstrumentSettingsDTO(
        @JsonProperty("incident_angle") ValueRangeDTO incidentAngle,
        ValueDTO wavelength,
        String polarization,
        @JsonProperty("slit_configuration") Map<String, ValueDTO> slitConfiguration,
        @JsonProperty("polarization_efficiency") Map<String, ValueDTO> polarizationEfficiency) {

    public static InstrumentSettingsDTO from(InstrumentSettings settings) {
        SlitData slits = settings.slitConfiguration();
        Map<String, ValueDTO> slitValues = new LinkedHashMap<>();
        slitValues.put("slit1_width", new ValueDTO(slits.slit1Width(), slits.units()));
        slitValues.put("slit2_width", new ValueDTO(slits.slit2Width(), slits.units()));
        slitValues.put("slit1_position", new ValueDTO(slits.slit1Position(), slits.units()));
        slitValues.put("slit2_position", new ValueDTO(slits.slit2Position(), slits.units()));

        PolarizationEfficiency efficiency = settings.polarizationEfficiency();
        Map<String, ValueDTO> efficiencyValues = new LinkedHashMap<>();
        efficiencyValues.put("polarizer", new ValueDTO(efficiency.polarizer(), null));
        efficiencyValues.put("analyser", new ValueDTO(efficiency.analyser(), null));
        efficiencyValues.put("spin_flipper_1", new ValueDTO(efficiency.spinFlipper1(), null));
        efficiencyValues.put("spin_flipper_2", new ValueDTO(efficiency.spinFlipper2(), null));

        return new InstrumentSettingsDTO(
                new ValueRangeDTO(settings.incidentAngleMin(), settings.incidentAngleMax(), settings.angleUnit()),
                new ValueDTO(settings.wavelength(), settings.wavelengthUnit()),
                settings.polarization().getCode(),
                slitValues,
                efficiencyValues);
    }
}
