/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.ExperimentData;
import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.MeasurementData;
import com.ammann.reflectometry.model.PersonData;
import com.ammann.reflectometry.model.SampleData;
import java.util.List;

/**
 * Read-only view of one raw reflectometry measurement.
 *
 * <p>Implementations back the same queries with different file formats. Channel
 * parameterised queries return only the scan rows whose spin-device states match the
 * channel code, see {@link PolarisationChannels}.
 */
public interface MetadataProvider {

    /** Location of the measurement, used for provenance and output naming. */
    String filePath();

    /** Detector and counter channels recorded in the scan. */
    List<String> detectors();

    /** Devices moved or switched during the scan. */
    List<String> scanDevices();

    /** Monitor counts of every scan row. */
    double[] monitor();

    /** Exposure time of every scan row. */
    double[] time();

    /**
     * Polarization channels present in the scan, never empty. Contains only
     * {@link PolarizationState#UNPOLARIZED} when no spin device is among the scan devices.
     */
    List<PolarizationState> polarisationStates();

    /**
     * Scan column of the given name restricted to the rows of one channel.
     *
     * @param column scan axis, device or point detector name
     * @param state channel to filter for
     * @throws com.ammann.reflectometry.exception.MetadataReadException if the column is missing
     */
    double[] column(String column, PolarizationState state);

    /**
     * Counts of a detector restricted to the rows of one channel.
     *
     * @param detector detector name from {@link #detectors()}
     * @param state channel to filter for
     */
    DetectorCounts counts(String detector, PolarizationState state);

    double[] monitor(PolarizationState state);

    double[] time(PolarizationState state);

    PersonData owner();

    ExperimentData experiment();

    SampleData sample();

    InstrumentSettings instrumentSettings(PolarizationState state);

    default MeasurementData measurement(PolarizationState state) {
        return new MeasurementData(instrumentSettings(state), filePath());
    }
}
