/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Raw measurement submitted as JSON.
 *
 * <p>{@code columns} holds the incident angle, monitor, time and point detector columns,
 * {@code devices} the states of switched devices such as spin flippers, and
 * {@code areaDetectors} detector frames indexed {@code [point][y][x]}. All columns have
 * one entry per scan point.
 */
@Schema(description = "Raw reflectometry scan with provenance")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RawMeasurementDTO(
        @Schema(description = "Name of the originating file") String fileName,
        PersonDTO owner,
        @NotNull(message = "experiment is required") ExperimentDTO experiment,
        @NotNull(message = "sample is required") SampleDTO sample,
        @Schema(description = "Wavelength") @Positive(message = "wavelength must be positive") double wavelength,
        @Schema(description = "Wavelength unit, default A") String wavelengthUnit,
        @Schema(description = "Incident angle unit, default deg") String angleUnit,
        @NotNull(message = "slits are required") SlitDTO slits,
        @Schema(description = "Numeric scan columns by name") @NotNull(message = "columns are required") Map<String, double[]> columns,
        @Schema(description = "Device state columns by device name") Map<String, List<String>> devices,
        @Schema(description = "Area detector frames by detector name") Map<String, double[][][]> areaDetectors) {}
