package com.lungrisk.training;

import com.lungrisk.training.pipeline.TrainingPipeline;
import com.lungrisk.training.pipeline.TrainingReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the training pipeline once at startup. A failure propagates so the process exits non-zero.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "lungrisk.training", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class TrainingJobRunner implements ApplicationRunner {

    private final TrainingPipeline pipeline;

    @Override
    public void run(ApplicationArguments args) {
        TrainingReport report = pipeline.run();
        log.info("Artifacts written to {} ({} training rows, {} test rows, best threshold {})",
            report.getArtifactDirectory().toAbsolutePath(), report.getTrainingRows(), report.getTestRows(),
            String.format("%.4f", report.getEvaluation().getBestThreshold()));
    }
}
