/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Reduction provenance")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReductionDTO(
        SoftwareDTO software,
        @Schema(description = "How the reduction was invoked") String call,
        @Schema(description = "Applied steps in pipeline order") List<String> corrections) {}
