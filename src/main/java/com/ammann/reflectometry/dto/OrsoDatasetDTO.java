/* (C)2026 */
package com.ammann.reflectometry.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "One polarization channel: header and rows of [Q, dQ, R, dR]")
public record OrsoDatasetDTO(
        OrsoHeaderDTO info,
        @Schema(description = "Rows of Q, dQ, R, dR") List<double[]> data) {}
