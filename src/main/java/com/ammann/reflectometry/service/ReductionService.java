/* (C)2026 */
package com.ammann.reflectometry.service;

import com.ammann.reflectometry.config.BackgroundCorrection;
import com.ammann.reflectometry.config.CorrectionParameters;
import com.ammann.reflectometry.config.IntensityNormalisation;
import com.ammann.reflectometry.config.NormalisationConfig;
import com.ammann.reflectometry.config.ReductionConfig;
import com.ammann.reflectometry.enumeration.PolarizationState;
import com.ammann.reflectometry.exception.ApiException;
import com.ammann.reflectometry.exception.UnsupportedCorrectionException;
import com.ammann.reflectometry.model.ChannelStage;
import com.ammann.reflectometry.model.DataSet;
import com.ammann.reflectometry.model.DataSetMetadata;
import com.ammann.reflectometry.model.DataSetOutput;
import com.ammann.reflectometry.model.DetectorSignal;
import com.ammann.reflectometry.model.InstrumentSettings;
import com.ammann.reflectometry.model.MomentumTransfer;
import com.ammann.reflectometry.model.Reflectivity;
import com.ammann.reflectometry.properties.InstrumentProperties;
import com.ammann.reflectometry.provider.MetadataProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the reduction pipeline for every polarization channel of a measurement.
 *
 * <p>Each channel passes through extraction, correction, normalisation, background
 * subtraction and intensity normalisation independently, so channels are reduced
 * concurrently on the reduction executor. Normalising to the maximum of all channels
 * needs every channel finished and runs after all of them have completed.
 */
@ApplicationScoped
public class ReductionService {

    private static final Logger LOG = Logger.getLogger(ReductionService.class);

    // Divisors closer to zero than this are replaced by its reciprocal
    static final double DIVISION_EPSILON = 1e-12;

    private final CorrectionService correctionService;
    private final QResolutionService qResolutionService;
    private final DetectorSignalExtractor signalExtractor;
    private final ReductionConfigValidator validator;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    private Counter reductionCounter;
    private Counter failureCounter;
    private Timer reductionTimer;

    @Inject
    public ReductionService(
            CorrectionService correctionService,
            QResolutionService qResolutionService,
            DetectorSignalExtractor signalExtractor,
            ReductionConfigValidator validator,
            @Named("reduction-executor") Executor executor,
            MeterRegistry meterRegistry) {
        this.correctionService = correctionService;
        this.qResolutionService = qResolutionService;
        this.signalExtractor = signalExtractor;
        this.validator = validator;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void initMetrics() {
        reductionCounter = Counter.builder("reflectometry_reductions_total")
                .description("Completed reductions")
                .register(meterRegistry);
        failureCounter = Counter.builder("reflectometry_reduction_failures_total")
                .description("Reductions aborted by an error")
                .register(meterRegistry);
        reductionTimer = Timer.builder("reflectometry_reduction_duration")
                .description("Duration of a complete reduction")
                .register(meterRegistry);
    }

    /**
     * Reduces a measurement to reflectivity curves, one per polarization channel.
     *
     * @param provider   measurement to reduce
     * @param parameters correction parameters
     * @return finalized channels in the order reported by the provider
     * @throws com.ammann.reflectometry.exception.ReductionConfigurationException if the
     *     parameters do not fit the measurement
     * @throws UnsupportedCorrectionException if an unimplemented correction is requested
     * @throws com.ammann.reflectometry.exception.MetadataReadException if the measurement
     *     lacks required data
     */
    public ReductionResult reduce(MetadataProvider provider, CorrectionParameters parameters) {
        if (reductionTimer == null) {
            initMetrics();
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ReductionResult result = runReduction(provider, parameters);
            reductionCounter.increment();
            return result;
        } catch (RuntimeException e) {
            failureCounter.increment();
            throw e;
        } finally {
            sample.stop(reductionTimer);
        }
    }

    private ReductionResult runReduction(MetadataProvider provider, CorrectionParameters parameters) {
        long start = System.nanoTime();
        validator.validate(parameters, provider);

        List<PolarizationState> states = provider.polarisationStates();
        LOG.infof("Reducing %s: detector=%s, channels=%s",
                provider.filePath(), parameters.dataSource().detector(), states);

        DataSetMetadata header =
                new DataSetMetadata(provider.owner(), provider.experiment(), provider.sample());

        List<CompletableFuture<ChannelStage.IntensityNormalized>> futures = states.stream()
                .map(state -> CompletableFuture.supplyAsync(
                        () -> reduceChannel(provider, parameters, header, state), executor))
                .toList();

        List<ChannelStage.IntensityNormalized> channels;
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            channels = futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            throw unwrap(e);
        }

        List<ChannelStage.Finalized> finalized = finalizeChannels(channels, parameters);
        LOG.infof("Reduced %s into %d channel(s) in %d ms",
                provider.filePath(), finalized.size(), (System.nanoTime() - start) / 1_000_000);
        return new ReductionResult(provider.filePath(), header, parameters, finalized);
    }

    private ChannelStage.IntensityNormalized reduceChannel(
            MetadataProvider provider,
            CorrectionParameters parameters,
            DataSetMetadata header,
            PolarizationState state) {
        ChannelStage.Extracted extracted = extract(provider, parameters, header, state);
        ChannelStage.IntensityNormalized result = normalizeIntensity(
                subtractBackground(normalize(correct(extracted, parameters), parameters), parameters),
                parameters);
        LOG.debugf("Channel %s: %d points, max R=%.4e",
                state.getCode(), result.dataSet().points(), result.reflectivity().max());
        return result;
    }

    /**
     * Pulls the raw arrays of one channel from the provider.
     */
    ChannelStage.Extracted extract(
            MetadataProvider provider,
            CorrectionParameters parameters,
            DataSetMetadata header,
            PolarizationState state) {
        double[] theta = provider.column(InstrumentProperties.INCIDENT_ANGLE_AXIS, state);
        DetectorSignal signal = signalExtractor.extract(
                provider.counts(parameters.dataSource().detector(), state), parameters);
        DataSet dataSet = new DataSet(
                header,
                provider.measurement(state),
                theta,
                provider.time(state),
                provider.monitor(state),
                signal.signal(),
                signal.signalError(),
                signal.background(),
                signal.backgroundError());
        return new ChannelStage.Extracted(dataSet);
    }

    /**
     * Computes Q and dQ and the combined footprint and absorption factor.
     */
    ChannelStage.Corrected correct(ChannelStage.Extracted extracted, CorrectionParameters parameters) {
        DataSet dataSet = extracted.dataSet();
        InstrumentSettings settings = dataSet.instrumentSettings();
        ReductionConfig reduction = parameters.reduction();

        MomentumTransfer momentumTransfer = qResolutionService.calculate(
                dataSet.theta(),
                settings.wavelength(),
                settings.slitConfiguration(),
                parameters.wavelengthResolution());

        double[] correction = new double[dataSet.points()];
        Arrays.fill(correction, 1.0);

        if (reduction.footprint()) {
            multiplyInto(correction, correctionService.footprintCorrection(
                    dataSet.theta(), settings.slitConfiguration(), dataSet.header().sample().length()));
        }
        if (reduction.absorptionEnabled()) {
            multiplyInto(correction, correctionService.absorptionCorrection(
                    dataSet.theta(),
                    settings.wavelength(),
                    reduction.absorption().mu(),
                    dataSet.header().sample()));
        }
        if (reduction.polarisation()) {
            throw UnsupportedCorrectionException.polarisationCorrection();
        }
        return new ChannelStage.Corrected(dataSet, momentumTransfer, correction);
    }

    /**
     * Turns counts into reflectivity using the correction factor and the monitor and
     * time normalisation.
     */
    ChannelStage.Normalized normalize(ChannelStage.Corrected corrected, CorrectionParameters parameters) {
        DataSet dataSet = corrected.dataSet();
        NormalisationConfig normalisation = parameters.normalisation();

        double[] norm = new double[dataSet.points()];
        Arrays.fill(norm, 1.0);
        if (normalisation.monitor()) {
            norm = safeDivide(norm, dataSet.monitor());
        }
        if (normalisation.time()) {
            norm = safeDivide(norm, dataSet.time());
        }

        double[] r = new double[dataSet.points()];
        double[] dr = new double[dataSet.points()];
        double[] correction = corrected.correction();
        for (int i = 0; i < r.length; i++) {
            r[i] = dataSet.counts()[i] * correction[i] * norm[i];
            dr[i] = dataSet.countsError()[i] * correction[i] * norm[i];
        }
        return new ChannelStage.Normalized(
                dataSet, corrected.momentumTransfer(), norm, new Reflectivity(r, dr));
    }

    /**
     * Subtracts the configured background from the reflectivity.
     */
    ChannelStage.BackgroundAdjusted subtractBackground(
            ChannelStage.Normalized normalized, CorrectionParameters parameters) {
        DataSet dataSet = normalized.dataSet();
        Reflectivity reflectivity = normalized.reflectivity();
        BackgroundCorrection background = parameters.background();

        if (background instanceof BackgroundCorrection.ConstantValue constant) {
            double[] r = Arrays.stream(reflectivity.r()).map(v -> v - constant.value()).toArray();
            reflectivity = new Reflectivity(r, reflectivity.dr().clone());
        } else if (background instanceof BackgroundCorrection.DetectorRegion) {
            double[] norm = normalized.normalization();
            double[] r = new double[dataSet.points()];
            double[] dr = new double[dataSet.points()];
            for (int i = 0; i < r.length; i++) {
                double scaledError = dataSet.backgroundError()[i] * norm[i];
                r[i] = reflectivity.r()[i] - dataSet.background()[i] * norm[i];
                dr[i] = Math.sqrt(reflectivity.dr()[i] * reflectivity.dr()[i] + scaledError * scaledError);
            }
            reflectivity = new Reflectivity(r, dr);
        } else if (background instanceof BackgroundCorrection.ExternalFile file) {
            throw UnsupportedCorrectionException.backgroundFromFile(file.file());
        }
        return new ChannelStage.BackgroundAdjusted(dataSet, normalized.momentumTransfer(), reflectivity);
    }

    /**
     * Applies the channel-local intensity normalisation. Normalisation to the maximum of
     * all channels is left to {@link #finalizeChannels}.
     */
    ChannelStage.IntensityNormalized normalizeIntensity(
            ChannelStage.BackgroundAdjusted adjusted, CorrectionParameters parameters) {
        IntensityNormalisation intensity = parameters.normalisation().intensity();
        Reflectivity reflectivity = adjusted.reflectivity();

        if (intensity instanceof IntensityNormalisation.ConstantValue constant) {
            reflectivity = reflectivity.dividedBy(constant.value());
        } else if (intensity instanceof IntensityNormalisation.DatasetMaximum) {
            reflectivity = scaleToMaximum(reflectivity, reflectivity.max(), adjusted.dataSet().polarization());
        } else if (intensity instanceof IntensityNormalisation.DetectorRegion) {
            throw UnsupportedCorrectionException.intensityFromDetectorRegion();
        }
        return new ChannelStage.IntensityNormalized(
                adjusted.dataSet(), adjusted.momentumTransfer(), reflectivity);
    }

    /**
     * Applies normalisation to the maximum over all channels, if configured, and freezes
     * the output columns.
     */
    List<ChannelStage.Finalized> finalizeChannels(
            List<ChannelStage.IntensityNormalized> channels, CorrectionParameters parameters) {
        boolean globalMaximum =
                parameters.normalisation().intensity() instanceof IntensityNormalisation.GlobalMaximum;
        double maximum = channels.stream()
                .mapToDouble(channel -> channel.reflectivity().max())
                .filter(Double::isFinite)
                .max()
                .orElse(Double.NaN);
        if (globalMaximum) {
            LOG.debugf("Normalising %d channel(s) to global maximum %.4e", channels.size(), Double.valueOf(maximum));
        }

        return channels.stream()
                .map(channel -> {
                    Reflectivity reflectivity = globalMaximum
                            ? scaleToMaximum(channel.reflectivity(), maximum, channel.dataSet().polarization())
                            : channel.reflectivity();
                    return new ChannelStage.Finalized(
                            channel.dataSet(), DataSetOutput.of(channel.momentumTransfer(), reflectivity));
                })
                .toList();
    }

    private static Reflectivity scaleToMaximum(
            Reflectivity reflectivity, double maximum, PolarizationState state) {
        if (!Double.isFinite(maximum) || maximum == 0.0) {
            LOG.warnf("Channel %s: maximum reflectivity %s cannot be used for normalisation, leaving unscaled",
                    state.getCode(), maximum);
            return reflectivity;
        }
        return reflectivity.dividedBy(maximum);
    }

    /**
     * Element-wise division where divisors with magnitude below {@value #DIVISION_EPSILON}
     * are replaced by {@code 1 / DIVISION_EPSILON}.
     */
    static double[] safeDivide(double[] numerator, double[] denominator) {
        double[] result = new double[numerator.length];
        for (int i = 0; i < result.length; i++) {
            double divisor = Math.abs(denominator[i]) < DIVISION_EPSILON
                    ? 1.0 / DIVISION_EPSILON
                    : denominator[i];
            result[i] = numerator[i] / divisor;
        }
        return result;
    }

    private static void multiplyInto(double[] target, double[] factor) {
        for (int i = 0; i < target.length; i++) {
            target[i] *= factor[i];
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ApiException("Channel reduction failed", cause != null ? cause : e);
    }

    /**
     * Outcome of a reduction.
     *
     * @param source     location of the reduced measurement
     * @param header     provenance shared by all channels
     * @param parameters parameters the reduction ran with
     * @param channels   finalized channels, one per polarization state
     */
    public record ReductionResult(
            String source,
            DataSetMetadata header,
            CorrectionParameters parameters,
            List<ChannelStage.Finalized> channels) {}
}
