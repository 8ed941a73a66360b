/* (C)2026 */
package com.ammann.reflectometry.model;

/**
 * Owner, experiment and sample of one input file. Read-only and shared by all of its
 * polarization channels.
 */
public record DataSetMetadata(PersonData owner, ExperimentData experiment, SampleData sample) {}
