/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.AbsorptionCoefficient;
import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.config.DataSourceConfig;
import com.ammann.reflectometry.config.IntensityNormalisation;
import com.ammann.reflectometry.config.ReductionConfig;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.exception.UnsupportedCorrectionException;
import com.ammann.reflectometry.model.RegionOfInterest;
import com.ammann.reflectometry.provider.MetadataProvider;
import com.ammann.reflectometry.support.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ReductionConfigValidatorTest
{

    private final ReductionConfigValidator validator = new ReductionConfigValidator();

    private MetadataProvider provider;

    @BeforeEach
    void setUp()
    {
        provider = mock(MetadataProvider.class);
        when(provider.detectors()).thenReturn(List.of("det1", "mon1", "timer", "2Ddata"));
    }

    @Test
    void acceptsPointDetectorWithDefaults()
    {
        assertThatCode(() -> validator.validate(TestDataFactory.monitorOnly(), provider))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsUnknownDetector()
    {
        CorrectionParameters parameters = new CorrectionParameters(
                new DataSourceConfig("det9", null), null, null, null, 0.05, null);

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(ReductionConfigurationException.class)
                .hasMessageContaining("det9")
                .hasMessageContaining("det1");
    }

    @Test
    void rejectsAreaDetectorWithoutRegion()
    {
        CorrectionParameters parameters =
                TestDataFactory.areaDetector(null, new BackgroundCorrection.Disabled());

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(ReductionConfigurationException.class)
                .hasMessageContaining("2Ddata");
    }

    @Test
    void rejectsRegionBackgroundOnAreaDetector()
    {
        RegionOfInterest region = new RegionOfInterest(0, 1, 0, 1);
        CorrectionParameters parameters =
                TestDataFactory.areaDetector(region, new BackgroundCorrection.DetectorRegion(region));

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(ReductionConfigurationException.class);
    }

    @Test
    void rejectsRegionBackgroundWithoutRegion()
    {
        CorrectionParameters parameters = TestDataFactory.monitorOnly(
                new IntensityNormalisation.Disabled(), new BackgroundCorrection.DetectorRegion(null));

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(ReductionConfigurationException.class);
    }

    @Test
    void acceptsRegionBackgroundOnPointDetector()
    {
        CorrectionParameters parameters = TestDataFactory.monitorOnly(
                new IntensityNormalisation.Disabled(),
                new BackgroundCorrection.DetectorRegion(new RegionOfInterest(0, 1, 0, 1)));

        assertThatCode(() -> validator.validate(parameters, provider)).doesNotThrowAnyException();
    }

    @Test
    void rejectsPolarisationCorrection()
    {
        CorrectionParameters parameters = new CorrectionParameters(
                new DataSourceConfig("det1", null),
                null,
                new ReductionConfig(false, new AbsorptionCoefficient.Disabled(), true),
                null,
                0.05,
                null);

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOfSatisfying(UnsupportedCorrectionException.class,
                        e -> assertThat(e.getCorrection()).isEqualTo("polarisation"));
    }

    @Test
    void rejectsBackgroundFromFile()
    {
        CorrectionParameters parameters = TestDataFactory.monitorOnly(
                new IntensityNormalisation.Disabled(), new BackgroundCorrection.ExternalFile("bg.dat"));

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(UnsupportedCorrectionException.class)
                .hasMessageContaining("bg.dat");
    }

    @Test
    void rejectsIntensityFromDetectorRegion()
    {
        CorrectionParameters parameters = TestDataFactory.monitorOnly(
                new IntensityNormalisation.DetectorRegion(1, new RegionOfInterest(0, 1, 0, 1)),
                new BackgroundCorrection.Disabled());

        assertThatThrownBy(() -> validator.validate(parameters, provider))
                .isInstanceOf(UnsupportedCorrectionException.class);
    }
}
