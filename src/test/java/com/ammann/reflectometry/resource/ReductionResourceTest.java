/* (C)2026 */
package com.ammann.reflectometry.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.config.DataSourceConfig;
import com.ammann.reflectometry.dto.OrsoDocumentDTO;
import com.ammann.reflectometry.dto.ReductionConfigurationDTO;
import com.ammann.reflectometry.exception.MetadataReadException;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.properties.ApiProperties;
import com.ammann.reflectometry.service.OrsoTextWriter;
import com.ammann.reflectometry.service.ReductionService;
import com.ammann.reflectometry.service.ResultAssemblerService;
import com.ammann.reflectometry.support.TestDataFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

@QuarkusTest
class ReductionResourceTest {

    @Inject ReductionService reductionService;

    @Inject ResultAssemblerService assembler;

    @Inject OrsoTextWriter writer;

    @Inject CorrectionParameters parameters;

    @Test
    void resource_classHasCorrectPath() {
        var path = ReductionResource.class.getAnnotation(Path.class);
        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo(ApiProperties.BASE_URL_V1 + ApiProperties.Reduction.BASE);
    }

    @Test
    void scanLogEndpointHasSubPath() throws NoSuchMethodException {
        Path path = ReductionResource.class
                .getMethod("reduceScanLog", String.class, String.class)
                .getAnnotation(Path.class);

        assertThat(path).isNotNull();
        assertThat(path.value()).isEqualTo(ApiProperties.Reduction.SCAN_LOG);
    }

    @Test
    void reduceScanLogReturnsOrsoText() {
        ReductionResource resource = buildResource();

        Response response = resource.reduceScanLog(
                "V17_00042.dat", TestDataFactory.resource("scans/unpolarized.dat"));

        assertThat(response.getStatus()).isEqualTo(200);
        String text = (String) response.getEntity();
        assertThat(text).startsWith("# # ORSO reflectivity data file");
        assertThat(text).contains("Made foot print correction with trapezoid beam");
        assertThat(text).contains("fileName=V17_00042.dat");
        assertThat(text.lines().filter(line -> !line.startsWith("#"))).hasSize(5);
        assertThat(response.getHeaderString("Content-Disposition")).contains("V17_00042.ort");
    }

    @Test
    void reduceScanLogToDocumentSplitsPolarizedChannels() {
        ReductionResource resource = buildResource();

        Response response = resource.reduceScanLogToDocument(
                "V17_pol.dat", TestDataFactory.resource("scans/polarized.dat"));

        OrsoDocumentDTO document = (OrsoDocumentDTO) response.getEntity();
        assertThat(document.datasets())
                .extracting(dataset -> dataset.info().dataSet())
                .containsExactly("mm", "mp", "pm", "pp");
        assertThat(document.datasets()).allSatisfy(dataset -> assertThat(dataset.data()).hasSize(2));
    }

    @Test
    void reduceRawMeasurementReturnsDocument() {
        ReductionResource resource = buildResource();

        Response response = resource.reduceRawMeasurement(TestDataFactory.pointMeasurement(6, 100, 1000, 10));

        OrsoDocumentDTO document = (OrsoDocumentDTO) response.getEntity();
        assertThat(document.source()).isEqualTo("point.dat");
        assertThat(document.datasets()).hasSize(1);
        assertThat(document.datasets().get(0).data()).hasSize(6);
    }

    @Test
    void rawAreaDetectorWithoutRegionIsRejected() {
        ReductionResource resource = buildResource();
        resource.parameters = new CorrectionParameters(
                new DataSourceConfig(TestDataFactory.AREA_DETECTOR, null),
                null, null, null, 0.05, null);

        assertThatThrownBy(() -> resource.reduceRawMeasurement(TestDataFactory.areaMeasurement(2, 4, 4, 1.0)))
                .isInstanceOf(ReductionConfigurationException.class);
    }

    @Test
    void emptyScanLogIsRejected() {
        ReductionResource resource = buildResource();

        assertThatThrownBy(() -> resource.reduceScanLog("empty.dat", " "))
                .isInstanceOf(MetadataReadException.class);
    }

    @Test
    void configurationDescribesActiveParameters() {
        ReductionResource resource = buildResource();

        ReductionConfigurationDTO configuration = (ReductionConfigurationDTO) resource.getConfiguration().getEntity();

        assertThat(configuration.detector()).isEqualTo("det1");
        assertThat(configuration.wavelengthResolution()).isEqualTo(0.05);
        assertThat(configuration.corrections()).contains("Made time normalisation", "Made monitor counts normalisation");
    }

    private ReductionResource buildResource() {
        ReductionResource resource = new ReductionResource();
        resource.reductionService = reductionService;
        resource.assembler = assembler;
        resource.writer = writer;
        resource.parameters = parameters;
        return resource;
    }
}
