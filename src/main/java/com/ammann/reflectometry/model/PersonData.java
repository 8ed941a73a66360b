/* (C)2026 */
package com.ammann.reflectometry.model;

import com.ammann.reflectometry.properties.InstrumentProperties;

public record PersonData(String name, String affiliation, String contact) {

    public PersonData {
        affiliation = affiliation == null ? InstrumentProperties.DEFAULT_AFFILIATION : affiliation;
    }

    public PersonData(String name, String contact) {
        this(name, null, contact);
    }
}
