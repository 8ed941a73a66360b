/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.dto.RawMeasurementDTO;
import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.ExperimentData;
import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.PersonData;
import com.ammann.reflectometry.model.PolarizationEfficiency;
import com.ammann.reflectometry.model.SampleData;
import com.ammann.reflectometry.model.SlitData;
import com.ammann.reflectometry.properties.InstrumentProperties;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Metadata provider backed by a raw measurement document received as JSON.
 *
 * <p>Unlike the scan log, the document can carry area detector frames, stored under
 * {@link InstrumentProperties#AREA_DETECTOR}.
 */
public class RawMeasurementMetadataProvider implements MetadataProvider {

    private static final Set<String> NON_DETECTOR_COLUMNS = Set.of(
            InstrumentProperties.INCIDENT_ANGLE_AXIS,
            InstrumentProperties.MONITOR_DETECTOR,
            InstrumentProperties.TIME_DETECTOR);

    private final RawMeasurementDTO measurement;
    private final Map<String, double[]> columns;
    private final Map<String, List<String>> devices;
    private final Map<String, double[][][]> areaDetectors;
    private final int rows;
    private final SlitData slits;

    /**
     * @param measurement raw document
     * @throws MetadataReadException if mandatory parts are missing or columns differ in length
     */
    public RawMeasurementMetadataProvider(RawMeasurementDTO measurement) {
        if (measurement == null || measurement.columns() == null) {
            throw new MetadataReadException("Raw measurement has no scan columns");
        }
        if (measurement.slits() == null || measurement.sample() == null) {
            throw new MetadataReadException("Raw measurement needs slit and sample information");
        }
        this.measurement = measurement;
        this.columns = measurement.columns();
        this.devices = measurement.devices() == null ? Map.of() : measurement.devices();
        this.areaDetectors = measurement.areaDetectors() == null ? Map.of() : measurement.areaDetectors();
        this.rows = requireColumn(InstrumentProperties.INCIDENT_ANGLE_AXIS).length;
        validateAreaDetectors();
        validateLengths();
        this.slits = slitConfiguration(measurement);
    }

    private void validateAreaDetectors() {
        for (String name : areaDetectors.keySet()) {
            if (!InstrumentProperties.AREA_DETECTOR.equals(name)) {
                throw new MetadataReadException(String.format(
                        "Area detector frames must be named '%s', got '%s'",
                        InstrumentProperties.AREA_DETECTOR, name));
            }
        }
    }

    private static SlitData slitConfiguration(RawMeasurementDTO measurement) {
        try {
            return measurement.slits().toModel();
        } catch (IllegalArgumentException e) {
            throw new MetadataReadException("Invalid slit geometry: " + e.getMessage(), e);
        }
    }

    private void validateLengths() {
        columns.forEach((name, values) -> requireLength(name, values.length));
        devices.forEach((name, values) -> requireLength(name, values.size()));
        areaDetectors.forEach((name, frames) -> requireLength(name, frames.length));
    }

    private void requireLength(String name, int length) {
        if (length != rows) {
            throw new MetadataReadException(
                    String.format("Column '%s' has %d entries, expected %d", name, length, rows));
        }
    }

    private double[] requireColumn(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new MetadataReadException(
                    String.format("Column '%s' not found in raw measurement %s", name, filePath()));
        }
        return values;
    }

    @Override
    public String filePath() {
        return measurement.fileName() == null ? "raw-measurement" : measurement.fileName();
    }

    @Override
    public List<String> detectors() {
        List<String> detectors = new ArrayList<>();
        columns.keySet().stream()
                .filter(name -> !NON_DETECTOR_COLUMNS.contains(name))
                .sorted()
                .forEach(detectors::add);
        areaDetectors.keySet().stream().sorted().forEach(detectors::add);
        return detectors;
    }

    @Override
    public List<String> scanDevices() {
        List<String> scanDevices = new ArrayList<>();
        scanDevices.add(InstrumentProperties.INCIDENT_ANGLE_AXIS);
        devices.keySet().stream().sorted().forEach(scanDevices::add);
        return scanDevices;
    }

    @Override
    public double[] monitor() {
        return requireColumn(InstrumentProperties.MONITOR_DETECTOR);
    }

    @Override
    public double[] time() {
        return requireColumn(InstrumentProperties.TIME_DETECTOR);
    }

    @Override
    public List<PolarizationState> polarisationStates() {
        return PolarisationChannels.channels(scanDevices());
    }

    @Override
    public double[] column(String column, PolarizationState state) {
        return PolarisationChannels.filter(requireColumn(column), rowMask(state));
    }

    @Override
    public DetectorCounts counts(String detector, PolarizationState state) {
        double[][][] frames = areaDetectors.get(detector);
        if (frames != null) {
            return new DetectorCounts.AreaCounts(PolarisationChannels.filter(frames, rowMask(state)));
        }
        return new DetectorCounts.PointCounts(column(detector, state));
    }

    @Override
    public double[] monitor(PolarizationState state) {
        return PolarisationChannels.filter(monitor(), rowMask(state));
    }

    @Override
    public double[] time(PolarizationState state) {
        return PolarisationChannels.filter(time(), rowMask(state));
    }

    private boolean[] rowMask(PolarizationState state) {
        List<List<String>> deviceStates = PolarisationChannels.presentDevices(scanDevices()).stream()
                .map(devices::get)
                .toList();
        return PolarisationChannels.rowMask(deviceStates, rows, state);
    }

    @Override
    public PersonData owner() {
        return measurement.owner() == null ? new PersonData(null, null) : measurement.owner().toModel();
    }

    @Override
    public ExperimentData experiment() {
        if (measurement.experiment() == null) {
            throw new MetadataReadException("Raw measurement has no experiment information");
        }
        return measurement.experiment().toModel();
    }

    @Override
    public SampleData sample() {
        return measurement.sample().toModel();
    }

    @Override
    public InstrumentSettings instrumentSettings(PolarizationState state) {
        double[] theta = requireColumn(InstrumentProperties.INCIDENT_ANGLE_AXIS);
        return new InstrumentSettings(
                Arrays.stream(theta).min().orElse(Double.NaN),
                Arrays.stream(theta).max().orElse(Double.NaN),
                measurement.angleUnit() == null ? "deg" : measurement.angleUnit(),
                measurement.wavelength(),
                measurement.wavelengthUnit() == null ? "A" : measurement.wavelengthUnit(),
                slits,
                state,
                PolarizationEfficiency.ideal());
    }
}
