/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Active correction parameters")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReductionConfigurationDTO(
        @Schema(description = "Signal detector") String detector,
        @Schema(description = "Signal region (ymin, ymax, xmin, xmax)") String region,
        @Schema(description = "Relative wavelength spread") double wavelengthResolution,
        @Schema(description = "Steps a reduction with these parameters applies") List<String> corrections) {}
