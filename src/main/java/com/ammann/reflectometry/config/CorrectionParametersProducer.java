/* (C)2026 */
package com.ammann.reflectometry.config;

import com.ammann.reflectometry.enumeration.AbsorptionMaterial;
import com.ammann.reflectometry.enumeration.AbsorptionMode;
import com.ammann.reflectometry.enumeration.BackgroundMode;
import com.ammann.reflectometry.enumeration.IntensityNormalisationMode;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.model.RegionOfInterest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer turning the {@code reflectometry.*} configuration keys into the
 * immutable {@link CorrectionParameters} tree.
 *
 * <p>Each mode key selects one variant of the corresponding sealed configuration type;
 * the remaining keys of a group are only read by the variant that needs them.
 */
@ApplicationScoped
public class CorrectionParametersProducer {

    private static final Logger LOG = Logger.getLogger(CorrectionParametersProducer.class);

    @ConfigProperty(name = "reflectometry.data-source.detector", defaultValue = "det1")
    String detector = "det1";

    @ConfigProperty(name = "reflectometry.data-source.region")
    Optional<String> region = Optional.empty();

    @ConfigProperty(name = "reflectometry.normalisation.time", defaultValue = "true")
    boolean timeNormalisation = true;

    @ConfigProperty(name = "reflectometry.normalisation.monitor", defaultValue = "true")
    boolean monitorNormalisation = true;

    @ConfigProperty(name = "reflectometry.normalisation.intensity.mode", defaultValue = "CONSTANT")
    String intensityMode = "CONSTANT";

    @ConfigProperty(name = "reflectometry.normalisation.intensity.value", defaultValue = "1.0")
    double intensityValue = 1.0;

    @ConfigProperty(name = "reflectometry.normalisation.intensity.point", defaultValue = "1")
    int intensityPoint = 1;

    @ConfigProperty(name = "reflectometry.normalisation.intensity.region")
    Optional<String> intensityRegion = Optional.empty();

    @ConfigProperty(name = "reflectometry.reduction.footprint", defaultValue = "true")
    boolean footprint = true;

    @ConfigProperty(name = "reflectometry.reduction.absorption.mode", defaultValue = "EXPLICIT")
    String absorptionMode = "EXPLICIT";

    @ConfigProperty(name = "reflectometry.reduction.absorption.mu", defaultValue = "0.0")
    double absorptionMu = 0.0;

    @ConfigProperty(name = "reflectometry.reduction.absorption.material", defaultValue = "GLASS")
    String absorptionMaterial = "GLASS";

    @ConfigProperty(name = "reflectometry.reduction.polarisation", defaultValue = "false")
    boolean polarisation = false;

    @ConfigProperty(name = "reflectometry.background.mode", defaultValue = "CONSTANT")
    String backgroundMode = "CONSTANT";

    @ConfigProperty(name = "reflectometry.background.value", defaultValue = "1e-12")
    double backgroundValue = 1e-12;

    @ConfigProperty(name = "reflectometry.background.region")
    Optional<String> backgroundRegion = Optional.empty();

    @ConfigProperty(name = "reflectometry.background.file")
    Optional<String> backgroundFile = Optional.empty();

    @ConfigProperty(name = "reflectometry.wavelength-resolution", defaultValue = "0.05")
    double wavelengthResolution = CorrectionParameters.DEFAULT_WAVELENGTH_RESOLUTION;

    /**
     * Produces the configured correction parameters.
     *
     * @return parameters shared read-only by all reductions
     * @throws ReductionConfigurationException if a mode or region value cannot be parsed
     */
    @Produces
    @Singleton
    public CorrectionParameters correctionParameters() {
        CorrectionParameters parameters = build();
        LOG.infof("Correction parameters loaded: detector=%s, intensity=%s, background=%s, footprint=%s",
                parameters.dataSource().detector(),
                parameters.normalisation().intensity().getClass().getSimpleName(),
                parameters.background().getClass().getSimpleName(),
                parameters.reduction().footprint());
        return parameters;
    }

    CorrectionParameters build() {
        DataSourceConfig dataSource =
                new DataSourceConfig(detector, parseRegion("reflectometry.data-source.region", region));
        NormalisationConfig normalisation =
                new NormalisationConfig(timeNormalisation, monitorNormalisation, intensity());
        ReductionConfig reduction = new ReductionConfig(footprint, absorption(), polarisation);
        return new CorrectionParameters(
                dataSource, normalisation, reduction, background(), wavelengthResolution, "");
    }

    private IntensityNormalisation intensity() {
        IntensityNormalisationMode mode = parseMode(
                "reflectometry.normalisation.intensity.mode", intensityMode, IntensityNormalisationMode.class);
        return switch (mode) {
            case NONE -> new IntensityNormalisation.Disabled();
            case CONSTANT -> new IntensityNormalisation.ConstantValue(intensityValue);
            case DATASET_MAXIMUM -> new IntensityNormalisation.DatasetMaximum();
            case GLOBAL_MAXIMUM -> new IntensityNormalisation.GlobalMaximum();
            case DETECTOR_REGION -> new IntensityNormalisation.DetectorRegion(
                    intensityPoint,
                    parseRegion("reflectometry.normalisation.intensity.region", intensityRegion));
        };
    }

    private AbsorptionCoefficient absorption() {
        AbsorptionMode mode = parseMode(
                "reflectometry.reduction.absorption.mode", absorptionMode, AbsorptionMode.class);
        return switch (mode) {
            case NONE -> new AbsorptionCoefficient.Disabled();
            case EXPLICIT -> new AbsorptionCoefficient.ExplicitValue(absorptionMu);
            case MATERIAL -> new AbsorptionCoefficient.Tabulated(parseMode(
                    "reflectometry.reduction.absorption.material", absorptionMaterial, AbsorptionMaterial.class));
        };
    }

    private BackgroundCorrection background() {
        BackgroundMode mode = parseMode("reflectometry.background.mode", backgroundMode, BackgroundMode.class);
        return switch (mode) {
            case NONE -> new BackgroundCorrection.Disabled();
            case CONSTANT -> new BackgroundCorrection.ConstantValue(backgroundValue);
            case DETECTOR_REGION -> new BackgroundCorrection.DetectorRegion(
                    parseRegion("reflectometry.background.region", backgroundRegion));
            case FILE -> new BackgroundCorrection.ExternalFile(backgroundFile.orElse(null));
        };
    }

    private static <E extends Enum<E>> E parseMode(String key, String value, Class<E> type) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw ReductionConfigurationException.invalidParameter(
                    key, value, "one of " + Arrays.toString(type.getEnumConstants()));
        }
    }

    private static RegionOfInterest parseRegion(String key, Optional<String> value) {
        if (value.isEmpty() || value.get().isBlank()) {
            return null;
        }
        try {
            return RegionOfInterest.parse(value.get());
        } catch (IllegalArgumentException e) {
            throw new ReductionConfigurationException(
                    String.format("Invalid parameter '%s': %s", key, e.getMessage()), e);
        }
    }
}
