/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.SlitData;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Two-slit collimation; positions are signed distances from the sample")
public record SlitDTO(
        double slit1Width, double slit2Width, double slit1Position, double slit2Position, String units) {

    public SlitData toModel() {
        return new SlitData(slit1Width, slit2Width, slit1Position, slit2Position, units);
    }
}
