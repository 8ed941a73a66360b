/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.dto.ColumnDTO;
import com.ammann.reflectometry.dto.OrsoDatasetDTO;
import com.ammann.reflectometry.dto.OrsoDocumentDTO;
import com.ammann.reflectometry.exception.ApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Writes exchange documents in the ORSO text representation: a commented YAML header per
 * dataset followed by whitespace separated data rows.
 */
@ApplicationScoped
public class OrsoTextWriter {

    private static final Logger LOG = Logger.getLogger(OrsoTextWriter.class);

    static final String BANNER =
            "# # ORSO reflectivity data file | 1.1 standard | YAML encoding | https://www.reflectometry.org/";
    static final String EXTENSION = ".ort";
    private static final String ROW_FORMAT = "%.9e";

    private final ObjectMapper yamlMapper;

    public OrsoTextWriter() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .build();
        this.yamlMapper = new ObjectMapper(factory)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Renders the document as text.
     *
     * @throws ApiException if a header cannot be serialised
     */
    public String write(OrsoDocumentDTO document) {
        StringBuilder out = new StringBuilder(BANNER).append('\n');
        List<OrsoDatasetDTO> datasets = document.datasets();
        for (int i = 0; i < datasets.size(); i++) {
            OrsoDatasetDTO dataset = datasets.get(i);
            if (i > 0) {
                out.append("# data_set: ").append(dataset.info().dataSet()).append('\n');
            }
            appendHeader(out, dataset);
            appendRows(out, dataset.data());
        }
        return out.toString();
    }

    /**
     * Writes the document to a file, replacing an existing one only once the new content
     * is complete.
     *
     * @return the written path
     * @throws ApiException if the file cannot be written
     */
    public Path write(OrsoDocumentDTO document, Path target) {
        String text = write(document);
        Path parent = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
            Path temporary = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            Files.writeString(temporary, text, StandardCharsets.UTF_8);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ApiException("Failed to write " + target, e);
        }
        LOG.infof("Wrote %d dataset(s) to %s", document.datasets().size(), target);
        return target;
    }

    /**
     * Resolves the output file for an input file.
     *
     * @param inputFile   path of the reduced input file
     * @param outputName  explicit output name, or {@code null} to derive it from the input stem
     * @param folder      output folder, ignored when {@code useInputFolder} is set
     * @param useInputFolder write next to the input file
     * @return path ending in {@code .ort}
     */
    public static Path resolveOutputPath(String inputFile, String outputName, Path folder, boolean useInputFolder) {
        Path input = Path.of(inputFile);
        String name = outputName == null || outputName.isBlank() ? stem(input) : outputName;
        if (!name.endsWith(EXTENSION)) {
            name += EXTENSION;
        }
        Path directory = useInputFolder || folder == null ? input.toAbsolutePath().getParent() : folder;
        return directory.resolve(name);
    }

    /** File name of the input without its last extension. */
    public static String stem(Path input) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private void appendHeader(StringBuilder out, OrsoDatasetDTO dataset) {
        String yaml;
        try {
            yaml = yamlMapper.writeValueAsString(dataset.info());
        } catch (JsonProcessingException e) {
            throw new ApiException("Failed to serialise dataset header " + dataset.info().dataSet(), e);
        }
        yaml.lines().forEach(line -> out.append("# ").append(line).append('\n'));
        out.append("# ").append(columnLine(dataset.info().columns())).append('\n');
    }

    private static String columnLine(List<ColumnDTO> columns) {
        return columns.stream()
                .map(column -> column.name() != null
                        ? column.name() + (column.unit() != null ? " (" + column.unit() + ")" : "")
                        : "s" + column.errorOf())
                .collect(Collectors.joining("    "));
    }

    private static void appendRows(StringBuilder out, List<double[]> rows) {
        for (double[] row : rows) {
            for (int j = 0; j < row.length; j++) {
                if (j > 0) {
                    out.append(' ');
                }
                out.append(String.format(Locale.ROOT, ROW_FORMAT, row[j]));
            }
            out.append('\n');
        }
    }
}
