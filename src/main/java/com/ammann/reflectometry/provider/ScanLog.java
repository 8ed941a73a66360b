/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.exception.MetadataReadException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsed content of a tab-delimited scan log.
 *
 * @param source file the log was read from
 * @param metadata {@code key : value} entries grouped by section title
 * @param header column names of the scan table
 * @param units column units, same order as {@code header}
 * @param rows table rows, each with one cell per column
 */
public record ScanLog(
        String source,
        Map<String, Map<String, String>> metadata,
        List<String> header,
        List<String> units,
        List<List<String>> rows) {

    /** Column separating scan devices from detectors. */
    public static final String DEVICE_SEPARATOR = ";";

    public static final String GENERAL_SECTION = "General";

    /** Scan devices: the columns before the separator. */
    public List<String> devices() {
        int separator = header.indexOf(DEVICE_SEPARATOR);
        return separator < 0 ? List.copyOf(header) : header.subList(0, separator);
    }

    /**
     * Detectors: the columns after the separator up to the first column whose name starts
     * with {@code file}. A second separator closing the range is not a detector.
     */
    public List<String> detectors() {
        int start = header.indexOf(DEVICE_SEPARATOR) + 1;
        int end = header.size();
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).startsWith("file")) {
                end = i;
                break;
            }
        }
        List<String> detectors = new ArrayList<>(header.subList(start, Math.max(start, end)));
        detectors.remove(DEVICE_SEPARATOR);
        return detectors;
    }

    public boolean hasColumn(String name) {
        return header.contains(name);
    }

    /** Raw cells of one column. */
    public List<String> column(String name) {
        int index = header.indexOf(name);
        if (index < 0) {
            throw new MetadataReadException(
                    String.format("Column '%s' not found in scan log %s", name, source));
        }
        return rows.stream().map(row -> index < row.size() ? row.get(index).trim() : "").toList();
    }

    /** Cells of one column parsed as numbers. */
    public double[] numericColumn(String name) {
        List<String> cells = column(name);
        double[] values = new double[cells.size()];
        for (int i = 0; i < values.length; i++) {
            try {
                values[i] = Double.parseDouble(cells.get(i));
            } catch (NumberFormatException e) {
                throw new MetadataReadException(
                        String.format("Non-numeric value '%s' in column '%s', row %d", cells.get(i), name, i + 1), e);
            }
        }
        return values;
    }

    /** Unit of a column as written in the unit line, empty if absent. */
    public String unit(String name) {
        int index = header.indexOf(name);
        return index >= 0 && index < units.size() ? units.get(index) : "";
    }

    public int size() {
        return rows.size();
    }

    /**
     * Returns a metadata value.
     *
     * @throws MetadataReadException if the section or key is missing
     */
    public String entry(String section, String key) {
        String value = metadata.getOrDefault(section, Map.of()).get(key);
        if (value == null) {
            throw MetadataReadException.missingEntry(section, key);
        }
        return value;
    }

    public Map<String, String> section(String section) {
        Map<String, String> values = metadata.get(section);
        if (values == null) {
            throw new MetadataReadException(
                    String.format("Missing metadata section '%s' in scan log %s", section, source));
        }
        return values;
    }
}
