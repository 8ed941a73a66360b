/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.ExperimentData;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Experiment the measurement belongs to")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperimentDTO(
        String title,
        String instrument,
        @JsonProperty("start_date") LocalDateTime startDate,
        String probe,
        String facility,
        @JsonProperty("proposalID") String proposalId,
        String doi) {

    public static ExperimentDTO from(ExperimentData experiment) {
        return new ExperimentDTO(
                experiment.title(),
                experiment.instrument(),
                experiment.startDate(),
                experiment.probe(),
                experiment.facility(),
                experiment.proposalId(),
                experiment.doi());
    }

    public ExperimentData toModel() {
        return new ExperimentData(title, instrument, startDate, proposalId, doi, probe, facility);
    }
}
