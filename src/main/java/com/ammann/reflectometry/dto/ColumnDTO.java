/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data column description. Error columns carry {@code error_of} instead of a name.
 */
@Schema(description = "Data column description")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDTO(
        String name,
        String unit,
        @JsonProperty("physical_quantity") String physicalQuantity,
        @JsonProperty("error_of") String errorOf,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("value_is") String valueIs) {

    public static ColumnDTO column(String name, String unit, String physicalQuantity) {
        return new ColumnDTO(name, unit, physicalQuantity, null, null, null);
    }

    /** One-sigma uncertainty of another column. */
    public static ColumnDTO errorOf(String column) {
        return new ColumnDTO(null, null, null, column, "uncertainty", "sigma");
    }
}
