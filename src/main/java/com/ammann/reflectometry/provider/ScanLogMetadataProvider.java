/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.ExperimentData;
import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.MeasurementData;
import com.ammann.reflectometry.model.PersonData;
import com.ammann.reflectometry.model.PolarizationEfficiency;
import com.ammann.reflectometry.model.SampleData;
import com.ammann.reflectometry.model.SlitData;
import com.ammann.reflectometry.properties.InstrumentProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata provider backed by a tab-delimited scan log.
 *
 * <p>The scan log only records point detectors; asking for the area detector fails.
 */
public class ScanLogMetadataProvider implements MetadataProvider {

    static final String EXPERIMENT_SECTION = "Experiment information";
    static final String INSTRUMENT_SECTION = "Instrument setup";
    static final String SAMPLE_SECTION = "Sample and alignment";
    static final String DEVICE_SECTION = "Device positions and sample environment state";

    private static final DateTimeFormatter START_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String filePath;
    private final ScanLog scanLog;

    public ScanLogMetadataProvider(String filePath, ScanLog scanLog) {
        this.filePath = filePath;
        this.scanLog = scanLog;
    }

    /** Reads the scan log at {@code path}. */
    public static ScanLogMetadataProvider open(Path path) {
        return new ScanLogMetadataProvider(path.toString(), ScanLogReader.read(path));
    }

    /** Parses scan log content received as text. */
    public static ScanLogMetadataProvider fromContent(String fileName, String content) {
        return new ScanLogMetadataProvider(fileName, ScanLogReader.parse(content, fileName));
    }

    public ScanLog scanLog() {
        return scanLog;
    }

    @Override
    public String filePath() {
        return filePath;
    }

    @Override
    public List<String> detectors() {
        return scanLog.detectors();
    }

    @Override
    public List<String> scanDevices() {
        return scanLog.devices();
    }

    @Override
    public double[] monitor() {
        return scanLog.numericColumn(InstrumentProperties.MONITOR_DETECTOR);
    }

    @Override
    public double[] time() {
        return scanLog.numericColumn(InstrumentProperties.TIME_DETECTOR);
    }

    @Override
    public List<PolarizationState> polarisationStates() {
        return PolarisationChannels.channels(scanDevices());
    }

    @Override
    public double[] column(String column, PolarizationState state) {
        return PolarisationChannels.filter(scanLog.numericColumn(column), rowMask(state));
    }

    @Override
    public DetectorCounts counts(String detector, PolarizationState state) {
        if (!scanLog.hasColumn(detector)) {
            throw new MetadataReadException(
                    String.format("Detector '%s' is not recorded in scan log %s", detector, filePath));
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
                .map(scanLog::column)
                .toList();
        return PolarisationChannels.rowMask(deviceStates, scanLog.size(), state);
    }

    /**
     * Owner from the experiment users entry: a dictionary literal with {@code name} and
     * {@code email}, or a comma-separated list of names of which the first is taken.
     */
    @Override
    public PersonData owner() {
        String users = scanLog.entry(EXPERIMENT_SECTION, "Exp_users");
        if (users.contains("{") && users.contains("}")) {
            JsonNode parsed = DictLiteralParser.parse(users);
            JsonNode user = parsed.isArray() ? parsed.path(0) : parsed;
            return new PersonData(DictLiteralParser.text(user, "name"), DictLiteralParser.text(user, "email"));
        }
        return new PersonData(users.split(",")[0].strip(), null);
    }

    @Override
    public ExperimentData experiment() {
        Map<String, String> setup = suffixKeys(scanLog.section(INSTRUMENT_SECTION));
        String date = scanLog.entry(ScanLog.GENERAL_SECTION, "Date");
        LocalDateTime startDate;
        try {
            startDate = LocalDateTime.parse(date, START_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new MetadataReadException("Invalid scan start date '" + date + "'", e);
        }
        return new ExperimentData(
                scanLog.entry(EXPERIMENT_SECTION, "Exp_title"),
                setup.get("instrument"),
                startDate,
                scanLog.entry(EXPERIMENT_SECTION, "Exp_proposal"),
                setup.get("doi"),
                "neutron",
                null);
    }

    /**
     * Sample looked up by {@code samplename} in the {@code samples} dictionary literal.
     * A sample missing from the dictionary is returned with its name only.
     */
    @Override
    public SampleData sample() {
        Map<String, String> entries = suffixKeys(scanLog.section(SAMPLE_SECTION));
        String name = entries.get("samplename");
        if (name == null) {
            throw MetadataReadException.missingEntry(SAMPLE_SECTION, "samplename");
        }
        String samples = entries.get("samples");
        if (samples == null) {
            return SampleData.named(name);
        }

        JsonNode parsed = DictLiteralParser.parse(samples);
        JsonNode dictionary = parsed.isArray() ? parsed.path(0) : parsed;
        for (JsonNode sample : dictionary) {
            if (name.equals(DictLiteralParser.text(sample, "name"))) {
                return new SampleData(
                        name,
                        DictLiteralParser.text(sample, "category"),
                        DictLiteralParser.text(sample, "composition"),
                        DictLiteralParser.text(sample, "description"),
                        DictLiteralParser.number(sample, "length", 0),
                        DictLiteralParser.number(sample, "thickness", 0),
                        DictLiteralParser.number(sample, "height", 0),
                        DictLiteralParser.text(sample, "units"));
            }
        }
        return SampleData.named(name);
    }

    /**
     * Slit widths from the third token of {@code <slit>_value}, positions and unit from
     * {@code d_<slit>_value}.
     */
    SlitData slitConfiguration() {
        String first = InstrumentProperties.Slits.FIRST;
        String second = InstrumentProperties.Slits.SECOND;
        String[] firstPosition = tokens("d_" + first + "_value");
        try {
            return new SlitData(
                    number(tokens(first + "_value"), 2),
                    number(tokens(second + "_value"), 2),
                    number(firstPosition, 0),
                    number(tokens("d_" + second + "_value"), 0),
                    firstPosition.length > 1 ? firstPosition[1] : "mm");
        } catch (IllegalArgumentException e) {
            throw new MetadataReadException("Invalid slit geometry in " + filePath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public InstrumentSettings instrumentSettings(PolarizationState state) {
        double[] theta = scanLog.numericColumn(InstrumentProperties.INCIDENT_ANGLE_AXIS);
        String[] wavelength = tokens(InstrumentProperties.WAVELENGTH_DEVICE + "_value");
        return new InstrumentSettings(
                Arrays.stream(theta).min().orElse(Double.NaN),
                Arrays.stream(theta).max().orElse(Double.NaN),
                scanLog.unit(InstrumentProperties.INCIDENT_ANGLE_AXIS),
                number(wavelength, 0),
                wavelength.length > 1 ? wavelength[1] : "A",
                slitConfiguration(),
                state,
                PolarizationEfficiency.ideal());
    }

    @Override
    public MeasurementData measurement(PolarizationState state) {
        String dataFile = scanLog.metadata().getOrDefault(ScanLog.GENERAL_SECTION, Map.of())
                .getOrDefault("filepath", filePath);
        return new MeasurementData(instrumentSettings(state), dataFile);
    }

    private String[] tokens(String key) {
        String value = scanLog.section(DEVICE_SECTION).get(key);
        if (value == null) {
            throw MetadataReadException.missingEntry(DEVICE_SECTION, key);
        }
        return value.strip().split("\\s+");
    }

    private static double number(String[] tokens, int index) {
        if (index >= tokens.length) {
            throw new MetadataReadException(
                    String.format("Expected at least %d values in '%s'", index + 1, String.join(" ", tokens)));
        }
        try {
            return Double.parseDouble(tokens[index]);
        } catch (NumberFormatException e) {
            throw new MetadataReadException("Non-numeric device value '" + tokens[index] + "'", e);
        }
    }

    /** Re-keys {@code Prefix_name} entries by {@code name}. */
    private static Map<String, String> suffixKeys(Map<String, String> section) {
        Map<String, String> result = new HashMap<>();
        section.forEach((key, value) -> {
            String[] parts = key.split("_");
            result.put(parts.length > 1 ? parts[1] : key, value);
        });
        return result;
    }
}
