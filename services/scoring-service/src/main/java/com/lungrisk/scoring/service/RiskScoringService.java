package com.lungrisk.scoring.service;

import com.lungrisk.common.artifact.ArtifactBundle;
import com.lungrisk.common.artifact.ModelMetadata;
import com.lungrisk.common.feature.EncodedFeatures;
import com.lungrisk.common.model.Probabilities;
import com.lungrisk.common.prevalence.PrevalenceAdjuster;
import com.lungrisk.common.prevalence.PrevalenceAdjustment;
import com.lungrisk.common.prevalence.PrevalencePolicy;
import com.lungrisk.scoring.dto.ModelMetadataResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Lung cancer risk scoring
 *
 * <p>Per request: encode raw attributes, standardise numeric features with the
 * persisted statistics, score with the calibrated classifier and, when both priors
 * are valid, correct the probability for the deployment prevalence.
 *
 * <p>Holds only the immutable artifact bundle and prevalence policy, so concurrent
 * requests need no coordination.
 */
@Slf4j
@Service
public class RiskScoringService {

    private final ArtifactBundle bundle;
    private final PrevalencePolicy prevalencePolicy;
    private final Timer scoringTimer;
    private final Counter adjustedCounter;
    private final Counter unadjustedCounter;

    public RiskScoringService(ArtifactBundle bundle, PrevalencePolicy prevalencePolicy, MeterRegistry meterRegistry) {
        this.bundle = bundle;
        this.prevalencePolicy = prevalencePolicy;
        this.scoringTimer = Timer.builder("lungrisk.predictions.latency")
            .description("Time taken to score a risk request")
            .register(meterRegistry);
        this.adjustedCounter = Counter.builder("lungrisk.predictions")
            .description("Risk predictions served")
            .tag("adjusted", "true")
            .register(meterRegistry);
        this.unadjustedCounter = Counter.builder("lungrisk.predictions")
            .description("Risk predictions served")
            .tag("adjusted", "false")
            .register(meterRegistry);
    }

    /**
     * Scores one set of raw attributes.
     *
     * @param rawAttributes           attribute name to loosely-typed value; absent names use defaults
     * @param deploymentPriorOverride request-level deployment prevalence, or null to use the configured default
     */
    public PredictionResult predict(Map<String, ?> rawAttributes, Double deploymentPriorOverride) {
        return scoringTimer.record(() -> score(rawAttributes, deploymentPriorOverride));
    }

    private PredictionResult score(Map<String, ?> rawAttributes, Double deploymentPriorOverride) {
        List<String> absent = bundle.getSchema().getFeatureOrder().stream()
            .filter(feature -> rawAttributes == null || !rawAttributes.containsKey(feature))
            .toList();
        if (!absent.isEmpty()) {
            log.debug("Attributes not supplied, using defaults: {}", absent);
        }

        EncodedFeatures encoded = bundle.getEncoder().encode(rawAttributes);
        double[] standardized = bundle.getScaling().transform(encoded.getFeatureOrder(), encoded.getValues());
        double rawProbability = Probabilities.clip(bundle.getModel().score(standardized));

        Double piTrain = prevalencePolicy.resolveTrainingPrior(bundle.getTrainingPrior());
        Double piDeploy = prevalencePolicy.resolveDeploymentPrior(deploymentPriorOverride);
        PrevalenceAdjustment adjustment = PrevalenceAdjuster.adjust(rawProbability, piTrain, piDeploy);

        (adjustment.isApplied() ? adjustedCounter : unadjustedCounter).increment();
        log.debug("Scored request: raw={}, adjusted={}, piTrain={}, piDeploy={}",
            rawProbability, adjustment.getAdjustedProbability(), piTrain, piDeploy);

        return PredictionResult.builder()
            .rawProbability(rawProbability)
            .adjustedProbability(adjustment.getAdjustedProbability())
            .usedAdjustment(adjustment.isApplied())
            .trainingPrior(piTrain)
            .deploymentPrior(piDeploy)
            .inputsUsed(encoded.getInputsUsed())
            .build();
    }

    public ModelMetadataResponse describeModel() {
        ModelMetadata metadata = bundle.getMetadata();
        return ModelMetadataResponse.builder()
            .featureOrder(bundle.getSchema().getFeatureOrder())
            .numericCols(bundle.getSchema().getNumericColumns())
            .binaryCols(bundle.getSchema().getBinaryColumns())
            .binaryMeaning(bundle.getSchema().getBinarySemantics())
            .target(bundle.getSchema().getTarget())
            .calibrationMethod(bundle.getModel().getCalibrationMethod())
            .modelFamily(bundle.getModel().getModelFamily())
            .piTrain(prevalencePolicy.resolveTrainingPrior(bundle.getTrainingPrior()))
            .piDeployDefault(prevalencePolicy.getDeploymentDefault())
            .trainingDataSource(metadata.getTrainingDataSourceIdentifier())
            .createdAt(metadata.getCreatedAt())
            .bestThreshold(metadata.getBestThreshold())
            .metrics(metadata.getMetrics())
            .build();
    }
}
