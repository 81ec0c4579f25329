package com.lungrisk.scoring.config;

import com.lungrisk.common.artifact.ArtifactBundle;
import com.lungrisk.common.artifact.ArtifactStore;
import com.lungrisk.common.prevalence.PrevalenceAdjuster;
import com.lungrisk.common.prevalence.PrevalencePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Loads the model artifact bundle exactly once at startup.
 *
 * <p>A missing or inconsistent bundle fails context startup; the service never runs
 * without a model. Replacing the model means restarting with a new directory.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class ArtifactConfig {

    @Bean
    public ArtifactStore artifactStore() {
        return new ArtifactStore();
    }

    @Bean
    public ArtifactBundle artifactBundle(ArtifactStore artifactStore, ScoringProperties properties) {
        Path directory = Path.of(properties.getArtifactDirectory());
        log.info("Loading model artifacts from {}", directory.toAbsolutePath());
        return artifactStore.load(directory);
    }

    /**
     * Prior settings are text so that a malformed value disables adjustment with a
     * warning instead of failing startup.
     */
    @Bean
    public PrevalencePolicy prevalencePolicy(ScoringProperties properties, ArtifactBundle artifactBundle) {
        ScoringProperties.Prevalence prevalence = properties.getPrevalence();
        Double trainingOverride = parseConfiguredPrior("training-override", prevalence.getTrainingOverride());
        Double deploymentDefault = parseConfiguredPrior("deployment-default", prevalence.getDeploymentDefault());
        PrevalencePolicy policy = PrevalencePolicy.builder()
            .trainingOverride(trainingOverride)
            .deploymentDefault(deploymentDefault)
            .build();

        if (trainingOverride != null && !PrevalenceAdjuster.isValidPrior(trainingOverride)) {
            log.warn("Training prior override {} is outside (0, 1); using the prior recorded with the model ({})",
                prevalence.getTrainingOverride(), artifactBundle.getTrainingPrior());
        }
        Double piTrain = policy.resolveTrainingPrior(artifactBundle.getTrainingPrior());
        if (!PrevalenceAdjuster.isValidPrior(piTrain)) {
            log.warn("Training prior {} is missing or outside (0, 1); prevalence adjustment is disabled", piTrain);
        }
        if (deploymentDefault != null && !PrevalenceAdjuster.isValidPrior(deploymentDefault)) {
            log.warn("Default deployment prior '{}' is not a value in (0, 1) and will not be applied",
                prevalence.getDeploymentDefault());
        }
        log.info("Prevalence policy: piTrain={}, default piDeploy={}", piTrain, policy.getDeploymentDefault());
        return policy;
    }

    private static Double parseConfiguredPrior(String name, String value) {
        Double prior = PrevalencePolicy.parsePrior(value);
        if (prior != null && prior.isNaN()) {
            log.warn("lungrisk.scoring.prevalence.{} '{}' is not a number; treating it as an invalid prior", name, value);
        }
        return prior;
    }
}
