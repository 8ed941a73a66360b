/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Origin of the reduced data: owner, experiment, sample and measurement")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataSourceDTO(
        PersonDTO owner, ExperimentDTO experiment, SampleDTO sample, MeasurementDTO measurement) {}
