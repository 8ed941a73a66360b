/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Software that performed the reduction")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SoftwareDTO(String name, String version, String platform) {}
