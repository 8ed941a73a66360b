/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Range of a physical value")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueRangeDTO(Double min, Double max, String unit) {}
