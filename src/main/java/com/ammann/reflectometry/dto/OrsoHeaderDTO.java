/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Header of one reduced dataset")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrsoHeaderDTO(
        @JsonProperty("data_source") DataSourceDTO dataSource,
        ReductionDTO reduction,
        @JsonProperty("data_set") String dataSet,
        List<ColumnDTO> columns) {}
