/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Physical value with unit")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueDTO(
        @Schema(description = "Numeric value") Double magnitude,
        @Schema(description = "Unit of the value") String unit) {}
