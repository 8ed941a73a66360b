/* (C)2026 */
package com.ammann.reflectometry.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.model.DetectorCounts;
import com.ammann.reflectometry.model.ExperimentData;
import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.PersonData;
import com.ammann.reflectometry.model.SampleData;
import com.ammann.reflectometry.model.SlitData;
import com.ammann.reflectometry.support.TestDataFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanLogMetadataProviderTest {

    private final ScanLogMetadataProvider unpolarized = ScanLogMetadataProvider.fromContent(
            "V17_00042.dat", TestDataFactory.resource("scans/unpolarized.dat"));

    private final ScanLogMetadataProvider polarized = ScanLogMetadataProvider.fromContent(
            "V17_pol.dat", TestDataFactory.resource("scans/polarized.dat"));

    @Test
    void detectorsAndDevicesComeFromTableHeader() {
        assertThat(unpolarized.detectors()).containsExactly("det1", "mon1", "timer");
        assertThat(unpolarized.scanDevices()).containsExactly("theta");
        assertThat(unpolarized.polarisationStates()).containsExactly(PolarizationState.UNPOLARIZED);
    }

    @Test
    void ownerIsFirstListedUser() {
        PersonData owner = unpolarized.owner();

        assertThat(owner.name()).isEqualTo("Jane Doe");
        assertThat(owner.affiliation()).isEqualTo("Helmholtz-Zentrum Berlin");
    }

    @Test
    void ownerIsReadFromDictionaryLiteral() {
        String content = TestDataFactory.resource("scans/unpolarized.dat").replace(
                "Exp_users : Jane Doe, John Roe",
                "Exp_users : [{'name': 'Max Muster', 'email': 'max@example.org', 'affiliation': None}]");

        PersonData owner = ScanLogMetadataProvider.fromContent("x.dat", content).owner();

        assertThat(owner.name()).isEqualTo("Max Muster");
        assertThat(owner.contact()).isEqualTo("max@example.org");
    }

    @Test
    void experimentCombinesInformationAndInstrumentSections() {
        ExperimentData experiment = unpolarized.experiment();

        assertThat(experiment.title()).isEqualTo("Magnetic multilayer");
        assertThat(experiment.instrument()).isEqualTo("V17");
        assertThat(experiment.doi()).isEqualTo("10.5442/NI000042");
        assertThat(experiment.proposalId()).isEqualTo("p12345");
        assertThat(experiment.startDate()).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 20, 30));
        assertThat(experiment.probe()).isEqualTo("neutron");
    }

    @Test
    void sampleIsLookedUpByName() {
        SampleData sample = unpolarized.sample();

        assertThat(sample.name()).isEqualTo("Fe/Si multilayer");
        assertThat(sample.length()).isEqualTo(20.0);
        assertThat(sample.thickness()).isEqualTo(1.0);
        assertThat(sample.height()).isEqualTo(10.0);
        assertThat(sample.composition()).isEqualTo("Si | Fe 10 | Si 5");
        assertThat(sample.description()).isNull();
    }

    @Test
    void unknownSampleNameKeepsNameOnly() {
        String content = TestDataFactory.resource("scans/unpolarized.dat")
                .replace("Sample_samplename : Fe/Si multilayer", "Sample_samplename : Reference");

        SampleData sample = ScanLogMetadataProvider.fromContent("x.dat", content).sample();

        assertThat(sample.name()).isEqualTo("Reference");
        assertThat(sample.length()).isZero();
    }

    @Test
    void slitsUseWidthFromEachSlitAndPositionsFromDistances() {
        SlitData slits = unpolarized.slitConfiguration();

        assertThat(slits.slit1Width()).isEqualTo(1.0);
        assertThat(slits.slit2Width()).isEqualTo(0.5);
        assertThat(slits.slit1Position()).isEqualTo(2000.0);
        assertThat(slits.slit2Position()).isEqualTo(200.0);
        assertThat(slits.units()).isEqualTo("mm");
    }

    @Test
    void instrumentSettingsSpanTheWholeScan() {
        InstrumentSettings settings = unpolarized.instrumentSettings(PolarizationState.UNPOLARIZED);

        assertThat(settings.incidentAngleMin()).isEqualTo(0.5);
        assertThat(settings.incidentAngleMax()).isEqualTo(4.0);
        assertThat(settings.angleUnit()).isEqualTo("deg");
        assertThat(settings.wavelength()).isEqualTo(4.66);
        assertThat(settings.wavelengthUnit()).isEqualTo("A");
        assertThat(settings.polarization()).isEqualTo(PolarizationState.UNPOLARIZED);
    }

    @Test
    void measurementReferencesRecordedFilePath() {
        assertThat(unpolarized.measurement(PolarizationState.UNPOLARIZED).dataFiles())
                .containsExactly("/data/2024/p12345/V17_00042.dat");
    }

    @Test
    void countsAreReadFromPointDetectorColumn() {
        DetectorCounts counts = unpolarized.counts("det1", PolarizationState.UNPOLARIZED);

        assertThat(counts).isInstanceOf(DetectorCounts.PointCounts.class);
        assertThat(((DetectorCounts.PointCounts) counts).counts()).containsExactly(1000, 800, 600, 400, 200);
        assertThat(unpolarized.monitor()).containsExactly(1000, 1000, 1000, 1000, 1000);
        assertThat(unpolarized.time()).containsExactly(10, 10, 10, 10, 10);
    }

    @Test
    void missingDetectorIsReported() {
        assertThatThrownBy(() -> unpolarized.counts("2Ddata", PolarizationState.UNPOLARIZED))
                .isInstanceOf(MetadataReadException.class)
                .hasMessageContaining("2Ddata");
    }

    @Test
    void polarizedScanIsSplitByFlipperStates() {
        assertThat(polarized.polarisationStates()).containsExactly(
                PolarizationState.MM, PolarizationState.MP, PolarizationState.PM, PolarizationState.PP);

        assertThat(polarized.column("theta", PolarizationState.PP)).containsExactly(1.0, 2.0);
        assertThat(((DetectorCounts.PointCounts) polarized.counts("det1", PolarizationState.PP)).counts())
                .containsExactly(400, 400);
        assertThat(((DetectorCounts.PointCounts) polarized.counts("det1", PolarizationState.PM)).counts())
                .containsExactly(40, 40);
        assertThat(((DetectorCounts.PointCounts) polarized.counts("det1", PolarizationState.MP)).counts())
                .containsExactly(60, 60);
        assertThat(((DetectorCounts.PointCounts) polarized.counts("det1", PolarizationState.MM)).counts())
                .containsExactly(800, 800);
        assertThat(polarized.monitor(PolarizationState.MM)).hasSize(2);
        assertThat(polarized.time(PolarizationState.MM)).hasSize(2);
    }

    @Test
    void opensScanLogFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("V17_00042.dat");
        Files.writeString(file, TestDataFactory.resource("scans/unpolarized.dat"));

        ScanLogMetadataProvider provider = ScanLogMetadataProvider.open(file);

        assertThat(provider.filePath()).isEqualTo(file.toString());
        assertThat(provider.scanLog().size()).isEqualTo(5);
    }

    @Test
    void invalidStartDateIsReported() {
        String content = TestDataFactory.resource("scans/unpolarized.dat")
                .replace("created at 2024-03-15 10:20:30", "created at yesterday");

        assertThatThrownBy(() -> ScanLogMetadataProvider.fromContent("x.dat", content).experiment())
                .isInstanceOf(MetadataReadException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void coincidentSlitPositionsAreUnreadableMetadata() {
        String content = TestDataFactory.resource("scans/unpolarized.dat")
                .replace("d_slit2_value : 200.0 mm", "d_slit2_value : 2000.0 mm");
        ScanLogMetadataProvider provider = ScanLogMetadataProvider.fromContent("x.dat", content);

        assertThatThrownBy(provider::slitConfiguration)
                .isInstanceOf(MetadataReadException.class)
                .hasMessageContaining("slit geometry");
    }
}
