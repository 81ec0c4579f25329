package com.lungrisk.training.pipeline;

import com.lungrisk.common.artifact.ModelMetadata;
import com.lungrisk.training.evaluation.EvaluationReport;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Duration;

@Getter
@Builder
public class TrainingReport {

    private final Path artifactDirectory;
    private final ModelMetadata metadata;
    private final EvaluationReport evaluation;
    private final int trainingRows;
    private final int testRows;
    private final Duration elapsed;
}
