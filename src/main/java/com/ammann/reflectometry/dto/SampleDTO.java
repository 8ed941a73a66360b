/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.SampleData;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Sample header block. The size vector holds length (x), height (y) and thickness (z).
 */
@Schema(description = "Measured sample")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SampleDTO(
        String name,
        String category,
        String composition,
        String description,
        @Schema(description = "Sample size: x = length, y = height, z = thickness") ValueVectorDTO size) {

    public static SampleDTO from(SampleData sample) {
        return new SampleDTO(
                sample.name(),
                sample.category(),
                sample.composition(),
                sample.description(),
                new ValueVectorDTO(sample.length(), sample.height(), sample.thickness(), sample.units()));
    }

    public SampleData toModel() {
        if (size == null) {
            return new SampleData(name, category, composition, description, 0, 0, 0, null);
        }
        return new SampleData(
                name,
                category,
                composition,
                description,
                valueOrZero(size.x()),
                valueOrZero(size.z()),
                valueOrZero(size.y()),
                size.unit());
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0 : value;
    }
}
