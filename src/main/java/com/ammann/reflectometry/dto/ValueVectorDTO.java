/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Three-component physical value")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueVectorDTO(Double x, Double y, Double z, String unit) {}
