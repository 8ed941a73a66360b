/* (C)2026 */
package com.ammann.reflectometry.provider;

import com.ammann.reflectometry.exception.MetadataReadException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Reader for scan logs written by the instrument control software.
 *
 * <p>The log consists of {@code ###} section titles, {@code # key : value} metadata
 * lines, and a scan table introduced by the {@code Scan data} section: a commented
 * column-name line, a commented unit line, then tab-separated rows.
 */
public final class ScanLogReader {

    private static final Logger LOG = Logger.getLogger(ScanLogReader.class);

    static final String FILE_TITLE = "NICOS data file";
    static final String SCAN_DATA_SECTION = "Scan data";

    private ScanLogReader() {}

    /**
     * Reads and parses a scan log file.
     *
     * @param path scan log location
     * @return parsed log
     * @throws MetadataReadException if the file cannot be read or holds no scan table
     */
    public static ScanLog read(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new MetadataReadException("Cannot read scan log " + path, e);
        }
    }

    /**
     * Parses scan log content.
     *
     * @param content full text of the log
     * @param source  name of the log used in messages and provenance
     * @return parsed log
     * @throws MetadataReadException if the content holds no scan table
     */
    public static ScanLog parse(String content, String source) {
        Map<String, Map<String, String>> metadata = new LinkedHashMap<>();
        List<String> header = List.of();
        List<String> units = List.of();
        List<List<String>> rows = new ArrayList<>();
        String section = null;
        boolean tableStarted = false;

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("###")) {
                section = stripMarkers(line);
                if (section.startsWith(FILE_TITLE)) {
                    int at = section.indexOf("at ");
                    if (at >= 0) {
                        metadata.computeIfAbsent(ScanLog.GENERAL_SECTION, k -> new LinkedHashMap<>())
                                .put("Date", section.substring(at + 3).strip());
                    }
                    section = ScanLog.GENERAL_SECTION;
                }
                continue;
            }

            if (line.startsWith("#") && !SCAN_DATA_SECTION.equals(section)) {
                String entry = line.replaceFirst("^#+", "").strip();
                int colon = entry.indexOf(':');
                if (colon >= 0) {
                    String target = section != null ? section : ScanLog.GENERAL_SECTION;
                    metadata.computeIfAbsent(target, k -> new LinkedHashMap<>())
                            .put(entry.substring(0, colon).strip(), entry.substring(colon + 1).strip());
                }
                continue;
            }

            if (line.startsWith("#") && !tableStarted) {
                header = splitCells(stripMarkers(line));
                tableStarted = true;
                continue;
            }

            if (line.startsWith("#")) {
                units = splitCells(stripMarkers(line));
                continue;
            }

            if (tableStarted) {
                rows.add(splitCells(stripMarkers(line)));
            }
        }

        if (header.isEmpty()) {
            throw new MetadataReadException("No scan table found in " + source);
        }

        LOG.debugf("Parsed scan log %s: %d sections, %d columns, %d rows",
                source, metadata.size(), header.size(), rows.size());

        return new ScanLog(source, metadata, header, units, rows);
    }

    private static List<String> splitCells(String line) {
        return Arrays.stream(line.split("\t")).map(String::strip).toList();
    }

    /** Removes leading and trailing '#' and blanks. */
    private static String stripMarkers(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && (line.charAt(start) == '#' || line.charAt(start) == ' ')) {
            start++;
        }
        while (end > start && (line.charAt(end - 1) == '#' || line.charAt(end - 1) == ' ')) {
            end--;
        }
        return line.substring(start, end);
    }
}
