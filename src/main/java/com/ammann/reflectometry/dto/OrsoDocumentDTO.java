/* (C)2026 */
package com.ammann.reflectometry.dto;

import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Reflectivity exchange document of one input file")
public record OrsoDocumentDTO(
        @Schema(description = "Input file the document was reduced from") String source,
        List<OrsoDatasetDTO> datasets) {}
