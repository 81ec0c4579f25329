package com.lungrisk.training.config;

import com.lungrisk.common.artifact.ArtifactStore;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.model.CalibratedClassifierTrainer;
import com.lungrisk.common.model.TreeEnsembleSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(TrainingProperties.class)
public class TrainingConfig {

    @Bean
    public FeatureSchema featureSchema() {
        return FeatureSchema.lungCancer();
    }

    @Bean
    public TreeEnsembleSettings treeEnsembleSettings(TrainingProperties properties) {
        TreeEnsembleSettings settings = TreeEnsembleSettings.builder()
            .numTrees(properties.getNumTrees())
            .maxDepth(properties.getMaxDepth())
            .executionSlots(properties.getExecutionSlots())
            .calibrationFolds(properties.getCalibrationFolds())
            .seed(properties.getRandomSeed())
            .build();
        log.info("Tree ensemble settings: {}", settings);
        return settings;
    }

    @Bean
    public CalibratedClassifierTrainer calibratedClassifierTrainer(TreeEnsembleSettings settings) {
        return new CalibratedClassifierTrainer(settings);
    }

    @Bean
    public ArtifactStore artifactStore() {
        return new ArtifactStore();
    }
}
