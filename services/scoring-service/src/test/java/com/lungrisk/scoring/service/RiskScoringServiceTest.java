package com.lungrisk.scoring.service;

import com.lungrisk.common.artifact.ArtifactBundle;
import com.lungrisk.common.artifact.ModelMetadata;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.prevalence.PrevalencePolicy;
import com.lungrisk.common.scaling.ScalingStatistics;
import com.lungrisk.scoring.StubProbabilityModel;
import com.lungrisk.scoring.dto.ModelMetadataResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RiskScoringService Unit Tests")
class RiskScoringServiceTest {

    private static final FeatureSchema SCHEMA = FeatureSchema.lungCancer();

    private StubProbabilityModel model;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    private RiskScoringService service(double probability, Double piTrain, PrevalencePolicy policy) {
        model = new StubProbabilityModel(SCHEMA.getFeatureOrder(), probability);
        ScalingStatistics scaling = new ScalingStatistics(List.of("age", "pack_years"),
            new double[]{50, 20}, new double[]{10, 15});
        ModelMetadata metadata = ModelMetadata.forSchema(SCHEMA)
            .piTrain(piTrain)
            .trainingDataSourceIdentifier("lung_cancer_dataset.csv")
            .bestThreshold(0.31)
            .build();
        return new RiskScoringService(ArtifactBundle.assemble(scaling, model, metadata), policy, meterRegistry);
    }

    private static Map<String, Object> scenarioRequest() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("age", 50);
        request.put("pack_years", 20);
        request.put("gender", "yes");
        request.put("radon_exposure", "no");
        request.put("asbestos_exposure", 0);
        request.put("secondhand_smoke_exposure", "true");
        request.put("copd_diagnosis", "n");
        request.put("alcohol_consumption", 1);
        request.put("family_history", "no");
        return request;
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("Should feed the model standardized numerics and schema-ordered indicators")
        void shouldStandardizeBeforeScoring() {
            RiskScoringService service = service(0.3, 0.1, PrevalencePolicy.none());

            PredictionResult result = service.predict(scenarioRequest(), null);

            assertThat(model.getLastFeatures()).containsExactly(0, 0, 1, 0, 0, 1, 0, 1, 0);
            assertThat(result.getInputsUsed())
                .containsEntry("age", 50.0)
                .containsEntry("gender", 1)
                .containsEntry("family_history", 0);
        }

        @Test
        @DisplayName("Should score an empty request with defaults instead of failing")
        void shouldScoreEmptyRequest() {
            RiskScoringService service = service(0.2, 0.1, PrevalencePolicy.none());

            PredictionResult result = service.predict(Map.of(), null);

            assertThat(result.getRawProbability()).isEqualTo(0.2);
            assertThat(model.getLastFeatures()[0]).isEqualTo(-5.0);
        }
    }

    @Nested
    @DisplayName("Prevalence adjustment")
    class Adjustment {

        @Test
        void shouldSkipAdjustmentWithoutDeploymentPrior() {
            RiskScoringService service = service(0.3, 0.1, PrevalencePolicy.none());

            PredictionResult result = service.predict(scenarioRequest(), null);

            assertThat(result.isUsedAdjustment()).isFalse();
            assertThat(result.getAdjustedProbability()).isNull();
            assertThat(result.getEffectiveProbability()).isEqualTo(0.3);
            assertThat(meterRegistry.counter("lungrisk.predictions", "adjusted", "false").count()).isEqualTo(1.0);
        }

        @Test
        void shouldApplyConfiguredDefault() {
            PrevalencePolicy policy = PrevalencePolicy.builder().deploymentDefault(0.1).build();
            RiskScoringService service = service(0.3, 0.1, policy);

            PredictionResult result = service.predict(scenarioRequest(), null);

            assertThat(result.isUsedAdjustment()).isTrue();
            assertThat(result.getAdjustedProbability()).isCloseTo(0.3, within(1e-9));
            assertThat(meterRegistry.counter("lungrisk.predictions", "adjusted", "true").count()).isEqualTo(1.0);
        }

        @Test
        void requestPriorShouldOverrideDefault() {
            PrevalencePolicy policy = PrevalencePolicy.builder().deploymentDefault(0.3).build();
            RiskScoringService service = service(0.5, 0.3, policy);

            PredictionResult result = service.predict(scenarioRequest(), 0.01);

            assertThat(result.getDeploymentPrior()).isEqualTo(0.01);
            assertThat(result.getEffectiveProbability()).isLessThan(0.05);
            assertThat(result.getRawProbability()).isEqualTo(0.5);
        }

        @Test
        void invalidRequestPriorShouldDisableAdjustment() {
            PrevalencePolicy policy = PrevalencePolicy.builder().deploymentDefault(0.3).build();
            RiskScoringService service = service(0.5, 0.1, policy);

            PredictionResult result = service.predict(scenarioRequest(), 1.5);

            assertThat(result.isUsedAdjustment()).isFalse();
            assertThat(result.getEffectiveProbability()).isEqualTo(0.5);
        }

        @Test
        void trainingOverrideShouldReplaceBundlePrior() {
            PrevalencePolicy policy = PrevalencePolicy.builder().trainingOverride(0.2).deploymentDefault(0.2).build();
            RiskScoringService service = service(0.4, 0.05, policy);

            PredictionResult result = service.predict(scenarioRequest(), null);

            assertThat(result.getTrainingPrior()).isEqualTo(0.2);
            assertThat(result.getAdjustedProbability()).isCloseTo(0.4, within(1e-9));
        }

        @Test
        @DisplayName("Should keep the recorded training prior when the override is out of range")
        void invalidTrainingOverrideShouldFallBackToBundlePrior() {
            PrevalencePolicy policy = PrevalencePolicy.builder().trainingOverride(1.5).deploymentDefault(0.01).build();
            RiskScoringService service = service(0.5, 0.30, policy);

            PredictionResult result = service.predict(scenarioRequest(), null);

            assertThat(result.getTrainingPrior()).isEqualTo(0.30);
            assertThat(result.isUsedAdjustment()).isTrue();
            assertThat(result.getAdjustedProbability()).isCloseTo(0.0230, within(1e-3));
        }

        @Test
        void missingTrainingPriorShouldDisableAdjustment() {
            PrevalencePolicy policy = PrevalencePolicy.builder().deploymentDefault(0.2).build();
            RiskScoringService service = service(0.4, null, policy);

            assertThat(service.predict(scenarioRequest(), 0.05).isUsedAdjustment()).isFalse();
        }
    }

    @Test
    void shouldClipCertainModelOutput() {
        RiskScoringService service = service(1.0, 0.1, PrevalencePolicy.none());

        PredictionResult result = service.predict(scenarioRequest(), null);

        assertThat(result.getRawProbability()).isLessThan(1.0);
        assertThat(RiskPercentages.toPercentage(result.getRawProbability())).isEqualByComparingTo("99.99");
    }

    @Test
    void shouldDescribeLoadedModel() {
        PrevalencePolicy policy = PrevalencePolicy.builder().deploymentDefault(0.02).build();
        RiskScoringService service = service(0.4, 0.25, policy);

        ModelMetadataResponse description = service.describeModel();

        assertThat(description.getFeatureOrder()).isEqualTo(SCHEMA.getFeatureOrder());
        assertThat(description.getPiTrain()).isEqualTo(0.25);
        assertThat(description.getPiDeployDefault()).isEqualTo(0.02);
        assertThat(description.getTrainingDataSource()).isEqualTo("lung_cancer_dataset.csv");
        assertThat(description.getBestThreshold()).isEqualTo(0.31);
        assertThat(description.getCalibrationMethod()).isEqualTo("isotonic");
    }
}
