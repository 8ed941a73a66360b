/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.config.DataSourceConfig;
import com.ammann.reflectometry.config.IntensityNormalisation;
import com.ammann.reflectometry.exception.ReductionConfigurationException;
import com.ammann.reflectometry.exception.UnsupportedCorrectionException;
import com.ammann.reflectometry.provider.MetadataProvider;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Checks correction parameters against a measurement before any reduction step runs.
 */
@ApplicationScoped
public class ReductionConfigValidator {

    /**
     * Validates the parameters for the given measurement.
     *
     * @param parameters correction parameters
     * @param provider   measurement to reduce
     * @throws ReductionConfigurationException if the parameters cannot be applied
     * @throws UnsupportedCorrectionException if an unimplemented correction is requested
     */
    public void validate(CorrectionParameters parameters, MetadataProvider provider) {
        DataSourceConfig dataSource = parameters.dataSource();
        if (!provider.detectors().contains(dataSource.detector())) {
            throw ReductionConfigurationException.unknownDetector(dataSource.detector(), provider.detectors());
        }
        if (dataSource.isAreaDetector() && dataSource.region() == null) {
            throw ReductionConfigurationException.missingRegion(dataSource.detector());
        }

        if (parameters.background() instanceof BackgroundCorrection.DetectorRegion backgroundRegion) {
            if (dataSource.isAreaDetector()) {
                throw ReductionConfigurationException.regionBackgroundOnAreaDetector(dataSource.detector());
            }
            if (backgroundRegion.region() == null) {
                throw ReductionConfigurationException.missingBackgroundRegion();
            }
        }

        validateSupported(parameters);
    }

    /**
     * Rejects corrections the configuration exposes but the reduction does not implement.
     *
     * @throws UnsupportedCorrectionException for the first unsupported correction found
     */
    public void validateSupported(CorrectionParameters parameters) {
        if (parameters.reduction().polarisation()) {
            throw UnsupportedCorrectionException.polarisationCorrection();
        }
        if (parameters.background() instanceof BackgroundCorrection.ExternalFile file) {
            throw UnsupportedCorrectionException.backgroundFromFile(file.file());
        }
        if (parameters.normalisation().intensity() instanceof IntensityNormalisation.DetectorRegion) {
            throw UnsupportedCorrectionException.intensityFromDetectorRegion();
        }
    }
}
