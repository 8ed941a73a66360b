/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.AbsorptionCoefficient;
import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.config.IntensityNormalisation;
import com.ammann.reflectometry.dto.ColumnDTO;
import com.ammann.reflectometry.dto.DataSourceDTO;
import com.ammann.reflectometry.dto.ExperimentDTO;
import com.ammann.reflectometry.dto.MeasurementDTO;
import com.ammann.reflectometry.dto.OrsoDatasetDTO;
import com.ammann.reflectometry.dto.OrsoDocumentDTO;
import com.ammann.reflectometry.dto.OrsoHeaderDTO;
import com.ammann.reflectometry.dto.PersonDTO;
import com.ammann.reflectometry.dto.ReductionConfigurationDTO;
import com.ammann.reflectometry.dto.ReductionDTO;
import com.ammann.reflectometry.dto.SampleDTO;
import com.ammann.reflectometry.dto.SoftwareDTO;
import com.ammann.reflectometry.model.ChannelStage;
import com.ammann.reflectometry.model.DataSetMetadata;
import com.ammann.reflectometry.model.DataSetOutput;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a finished reduction into the reflectivity exchange document and records which
 * steps produced it.
 */
@ApplicationScoped
public class ResultAssemblerService {

    static final String Q_UNIT = "1/Angstrom";

    @ConfigProperty(name = "reflectometry.software.name", defaultValue = "reflectometry-reducer")
    String softwareName = "reflectometry-reducer";

    @ConfigProperty(name = "quarkus.application.version", defaultValue = "dev")
    String softwareVersion = "dev";

    /**
     * Builds the exchange document with one dataset per channel.
     *
     * @param result finished reduction
     * @return document ready for serialisation
     */
    public OrsoDocumentDTO assemble(ReductionService.ReductionResult result) {
        ReductionDTO reduction = new ReductionDTO(
                software(), result.parameters().programCall(), corrections(result.parameters()));
        List<OrsoDatasetDTO> datasets = result.channels().stream()
                .map(channel -> toDataset(channel, reduction))
                .toList();
        return new OrsoDocumentDTO(result.source(), datasets);
    }

    /**
     * Summarises parameters for clients without running a reduction.
     */
    public ReductionConfigurationDTO describe(CorrectionParameters parameters) {
        return new ReductionConfigurationDTO(
                parameters.dataSource().detector(),
                parameters.dataSource().region() == null ? null : parameters.dataSource().region().toString(),
                parameters.wavelengthResolution(),
                corrections(parameters));
    }

    /**
     * Narrative of the applied steps, one sentence each, in pipeline order.
     *
     * @param parameters parameters of the reduction
     * @return step descriptions
     */
    public List<String> corrections(CorrectionParameters parameters) {
        List<String> steps = new ArrayList<>();

        String source = "Collect intensity from " + parameters.dataSource().detector();
        if (parameters.dataSource().region() != null) {
            source += " from region " + parameters.dataSource().region();
        }
        steps.add(source);

        if (parameters.reduction().footprint()) {
            steps.add("Made foot print correction with trapezoid beam");
        }
        AbsorptionCoefficient absorption = parameters.reduction().absorption();
        if (absorption instanceof AbsorptionCoefficient.ExplicitValue explicit) {
            steps.add("Made absorption correction with mu = " + format(explicit.mu()));
        } else if (absorption instanceof AbsorptionCoefficient.Tabulated tabulated) {
            steps.add(String.format(Locale.ROOT, "Made absorption correction with mu(%s) = %s",
                    tabulated.material().getLabel(), format(tabulated.mu())));
        }

        if (parameters.normalisation().time()) {
            steps.add("Made time normalisation");
        }
        if (parameters.normalisation().monitor()) {
            steps.add("Made monitor counts normalisation");
        }
        IntensityNormalisation intensity = parameters.normalisation().intensity();
        if (intensity instanceof IntensityNormalisation.ConstantValue constant) {
            steps.add("Made intensity normalisation by constant value " + format(constant.value()));
        } else if (intensity instanceof IntensityNormalisation.DatasetMaximum) {
            steps.add("Made intensity normalisation by maximum intensity point in current dataset");
        } else if (intensity instanceof IntensityNormalisation.GlobalMaximum) {
            steps.add("Made intensity normalisation by maximum intensity point of all datasets");
        } else if (intensity instanceof IntensityNormalisation.DetectorRegion region) {
            steps.add(String.format(Locale.ROOT,
                    "Made intensity normalisation by PSD region %s at point %d",
                    region.region(), region.pointIndex()));
        }

        BackgroundCorrection background = parameters.background();
        if (background instanceof BackgroundCorrection.ConstantValue constant) {
            steps.add("Made background correction with constant value " + format(constant.value()));
        } else if (background instanceof BackgroundCorrection.DetectorRegion region) {
            steps.add("Made background correction from PSD in region " + region.region());
        } else if (background instanceof BackgroundCorrection.ExternalFile file) {
            steps.add("Made background correction from file " + file.file());
        }

        steps.add("Calculate Q from Angle");
        steps.add(String.format(Locale.ROOT,
                "Calculate dQ from Slit parameters and delta lambda / lambda = %.1f%%",
                parameters.wavelengthResolution() * 100));
        steps.add("Calculate dR like Poisson distribution");
        return steps;
    }

    List<ColumnDTO> columns() {
        return List.of(
                ColumnDTO.column("Q", Q_UNIT, "normal momentum transfer"),
                ColumnDTO.errorOf("Q"),
                ColumnDTO.column("R", null, "reflectivity"),
                ColumnDTO.errorOf("R"));
    }

    private OrsoDatasetDTO toDataset(ChannelStage.Finalized channel, ReductionDTO reduction) {
        DataSetMetadata header = channel.dataSet().header();
        DataSourceDTO dataSource = new DataSourceDTO(
                PersonDTO.from(header.owner()),
                ExperimentDTO.from(header.experiment()),
                SampleDTO.from(header.sample()),
                MeasurementDTO.from(channel.dataSet().measurement()));
        OrsoHeaderDTO info = new OrsoHeaderDTO(
                dataSource, reduction, channel.dataSet().polarization().getCode(), columns());

        DataSetOutput output = channel.output();
        List<double[]> rows = new ArrayList<>(output.points());
        for (int i = 0; i < output.points(); i++) {
            rows.add(output.row(i));
        }
        return new OrsoDatasetDTO(info, rows);
    }

    private SoftwareDTO software() {
        return new SoftwareDTO(softwareName, softwareVersion, System.getProperty("os.name"));
    }

    private static String format(double value) {
        return Double.toString(value);
    }
}
