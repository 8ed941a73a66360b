/* (C)2026 */
package com.ammann.reflectometry.dto;

import com.ammann.reflectometry.model.PersonData;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Owner of the measured data")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersonDTO(String name, String affiliation, String contact) {

    public static PersonDTO from(PersonData person) {
        return new PersonDTO(person.name(), person.affiliation(), person.contact());
    }

    public PersonData toModel() {
        return new PersonData(name, affiliation, contact);
    }
}
