/* (C)2026 */
package com.ammann.reflectometry.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.support.TestDataFactory;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanLogReaderTest {

    @TempDir Path tempDir;

    @Test
    void parsesSectionsHeaderUnitsAndRows() {
        ScanLog log = ScanLogReader.parse(TestDataFactory.resource("scans/unpolarized.dat"), "unpolarized.dat");

        assertThat(log.header()).containsExactly("theta", ";", "det1", "mon1", "timer", ";", "filename");
        assertThat(log.unit("theta")).isEqualTo("deg");
        assertThat(log.unit("timer")).isEqualTo("s");
        assertThat(log.size()).isEqualTo(5);
        assertThat(log.numericColumn("det1")).containsExactly(1000, 800, 600, 400, 200);
        assertThat(log.entry(ScanLog.GENERAL_SECTION, "Date")).isEqualTo("2024-03-15 10:20:30");
        assertThat(log.entry("Experiment information", "Exp_proposal")).isEqualTo("p12345");
        assertThat(log.entry("Device positions and sample environment state", "d_slit1_value"))
                .isEqualTo("2000.0 mm");
    }

    @Test
    void splitsDevicesAndDetectorsAtSeparator() {
        ScanLog log = ScanLogReader.parse(TestDataFactory.resource("scans/polarized.dat"), "polarized.dat");

        assertThat(log.devices()).containsExactly("theta", "pflipper", "aflipper");
        assertThat(log.detectors()).containsExactly("det1", "mon1", "timer");
    }

    @Test
    void metadataValueMayContainColons() {
        String content = String.join("\n",
                "### Experiment information",
                "# Exp_title : Run 1: substrate",
                "### Scan data",
                "# theta\t;\tdet1",
                "# deg\t;\tcts",
                "0.5\t;\t10");

        ScanLog log = ScanLogReader.parse(content, "inline");

        assertThat(log.entry("Experiment information", "Exp_title")).isEqualTo("Run 1: substrate");
    }

    @Test
    void contentWithoutScanTableIsRejected() {
        assertThatThrownBy(() -> ScanLogReader.parse("### Experiment information\n# Exp_title : x\n", "empty.dat"))
                .isInstanceOf(MetadataReadException.class)
                .hasMessageContaining("empty.dat");
    }

    @Test
    void missingEntryIsReported() {
        ScanLog log = ScanLogReader.parse(TestDataFactory.resource("scans/unpolarized.dat"), "unpolarized.dat");

        assertThatThrownBy(() -> log.entry("Experiment information", "Exp_localcontact"))
                .isInstanceOf(MetadataReadException.class)
                .hasMessageContaining("Exp_localcontact");
        assertThatThrownBy(() -> log.column("det2")).isInstanceOf(MetadataReadException.class);
    }

    @Test
    void unreadableFileIsReported() {
        assertThatThrownBy(() -> ScanLogReader.read(tempDir.resolve("missing.dat")))
                .isInstanceOf(MetadataReadException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
