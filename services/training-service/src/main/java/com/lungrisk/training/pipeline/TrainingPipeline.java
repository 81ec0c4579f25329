package com.lungrisk.training.pipeline;

import com.lungrisk.common.artifact.ArtifactStore;
import com.lungrisk.common.artifact.ModelMetadata;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.model.CalibratedClassifier;
import com.lungrisk.common.model.CalibratedClassifierTrainer;
import com.lungrisk.common.model.StratifiedSampler;
import com.lungrisk.common.scaling.ScalingStatistics;
import com.lungrisk.common.scaling.StandardScaler;
import com.lungrisk.training.config.TrainingProperties;
import com.lungrisk.training.data.CsvDatasetLoader;
import com.lungrisk.training.data.DatasetEncoder;
import com.lungrisk.training.data.LabeledDataset;
import com.lungrisk.training.data.RawDataset;
import com.lungrisk.training.evaluation.EvaluationReport;
import com.lungrisk.training.evaluation.ModelEvaluator;
import com.lungrisk.training.exception.SchemaValidationException;
import com.lungrisk.training.exception.TrainingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offline batch job that turns a labeled CSV into the scaler, calibrated classifier and
 * metadata consumed by the scoring service.
 *
 * <p>Stages run strictly in order; any failure aborts the run with a {@link TrainingException}
 * naming the stage, and no partial artifacts are written because persistence is the last stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingPipeline {

    private final TrainingProperties properties;
    private final FeatureSchema schema;
    private final CsvDatasetLoader loader;
    private final DatasetEncoder datasetEncoder;
    private final CalibratedClassifierTrainer trainer;
    private final ModelEvaluator evaluator;
    private final ArtifactStore artifactStore;

    public TrainingReport run() {
        return run(Paths.get(properties.getDataSource()), Paths.get(properties.getOutputDirectory()));
    }

    public TrainingReport run(Path dataSource, Path outputDirectory) {
        Instant started = Instant.now();
        TrainingStage stage = TrainingStage.LOAD_DATA;
        try {
            log.info("Training run started: source={}, output={}", dataSource.toAbsolutePath(),
                outputDirectory.toAbsolutePath());

            logStage(stage);
            RawDataset raw = loader.load(dataSource);
            if (raw.size() == 0) {
                throw new TrainingException(stage, "Training data " + raw.getSource() + " has no rows");
            }

            stage = TrainingStage.VALIDATE_COLUMNS;
            logStage(stage);
            List<String> missing = schema.requiredColumns().stream()
                .filter(column -> !raw.getColumns().contains(column))
                .toList();
            if (!missing.isEmpty()) {
                throw new SchemaValidationException(raw.getSource(), missing);
            }

            stage = TrainingStage.ENCODE_LABELS_AND_FEATURES;
            logStage(stage);
            LabeledDataset dataset = datasetEncoder.encode(raw, schema);
            double piTrain = dataset.positiveRate();
            if (dataset.positiveCount() == 0 || dataset.positiveCount() == dataset.size()) {
                throw new TrainingException(stage, "Label column '" + schema.getTarget()
                    + "' must contain both classes (positive rate " + piTrain + ")");
            }

            stage = TrainingStage.SPLIT_TRAIN_TEST;
            logStage(stage);
            StratifiedSampler.Split split = StratifiedSampler.split(
                dataset.getLabels(), properties.getTestFraction(), properties.getRandomSeed());
            double[][] trainRows = dataset.rows(split.getTrainIndices());
            int[] trainLabels = dataset.labels(split.getTrainIndices());
            double[][] testRows = dataset.rows(split.getTestIndices());
            int[] testLabels = dataset.labels(split.getTestIndices());
            log.info("Stratified split: {} training rows, {} test rows", trainRows.length, testRows.length);

            stage = TrainingStage.FIT_SCALER;
            logStage(stage);
            List<String> featureOrder = schema.getFeatureOrder();
            ScalingStatistics scaling = StandardScaler.fit(featureOrder, trainRows, schema.getNumericColumns());
            log.info("Fitted {}", scaling);

            stage = TrainingStage.FIT_CALIBRATED_CLASSIFIER;
            logStage(stage);
            CalibratedClassifier model = trainer.fit(featureOrder, transform(scaling, featureOrder, trainRows),
                trainLabels, schema.getTarget());

            stage = TrainingStage.EVALUATE;
            logStage(stage);
            double[][] scaledTest = transform(scaling, featureOrder, testRows);
            double[] probabilities = new double[scaledTest.length];
            for (int i = 0; i < scaledTest.length; i++) {
                probabilities[i] = model.score(scaledTest[i]);
            }
            EvaluationReport evaluation = evaluator.evaluate(probabilities, testLabels);

            stage = TrainingStage.PERSIST_ARTIFACTS;
            logStage(stage);
            ModelMetadata metadata = ModelMetadata.forSchema(schema)
                .piTrain(piTrain)
                .calibrationMethod(model.getCalibrationMethod())
                .modelFamily(model.getModelFamily())
                .trainingDataSourceIdentifier(raw.getSource())
                .createdAt(Instant.now())
                .randomSeed(properties.getRandomSeed())
                .bestThreshold(evaluation.getBestThreshold())
                .metrics(evaluation.toMetrics())
                .versions(versions())
                .build();
            artifactStore.save(outputDirectory, scaling, model, metadata);

            Duration elapsed = Duration.between(started, Instant.now());
            log.info("Training run completed in {} ms: piTrain={}, ROC-AUC={}, artifacts in {}",
                elapsed.toMillis(), String.format("%.4f", piTrain),
                String.format("%.4f", evaluation.getRocAuc()), outputDirectory.toAbsolutePath());
            return TrainingReport.builder()
                .artifactDirectory(outputDirectory)
                .metadata(metadata)
                .evaluation(evaluation)
                .trainingRows(trainRows.length)
                .testRows(testRows.length)
                .elapsed(elapsed)
                .build();
        } catch (TrainingException e) {
            log.error("Training aborted: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Training aborted at stage {}", stage, e);
            throw new TrainingException(stage, e.getMessage(), e);
        }
    }

    private static double[][] transform(ScalingStatistics scaling, List<String> featureOrder, double[][] rows) {
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = scaling.transform(featureOrder, rows[i]);
        }
        return scaled;
    }

    private static Map<String, String> versions() {
        Map<String, String> versions = new LinkedHashMap<>();
        versions.put("java", System.getProperty("java.version"));
        versions.put("weka", weka.core.Version.VERSION);
        return versions;
    }

    private static void logStage(TrainingStage stage) {
        log.info("Stage {}", stage);
    }
}
