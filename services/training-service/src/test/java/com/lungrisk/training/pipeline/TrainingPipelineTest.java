package com.lungrisk.training.pipeline;

import com.lungrisk.common.artifact.ArtifactBundle;
import com.lungrisk.common.artifact.ArtifactStore;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.model.CalibratedClassifierTrainer;
import com.lungrisk.common.model.TreeEnsembleSettings;
import com.lungrisk.training.config.TrainingProperties;
import com.lungrisk.training.data.CsvDatasetLoader;
import com.lungrisk.training.data.DatasetEncoder;
import com.lungrisk.training.evaluation.ModelEvaluator;
import com.lungrisk.training.exception.SchemaValidationException;
import com.lungrisk.training.exception.TrainingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@DisplayName("TrainingPipeline Tests")
class TrainingPipelineTest {

    private static final String HEADER = "patient_id,age,gender,pack_years,radon_exposure,asbestos_exposure,"
        + "secondhand_smoke_exposure,copd_diagnosis,alcohol_consumption,family_history,lung_cancer";

    @TempDir
    Path workDir;

    private TrainingPipeline pipeline;
    private ArtifactStore artifactStore;

    @BeforeEach
    void setUp() {
        TrainingProperties properties = new TrainingProperties();
        properties.setCalibrationFolds(3);
        properties.setNumTrees(10);
        TreeEnsembleSettings settings = TreeEnsembleSettings.builder()
            .numTrees(properties.getNumTrees())
            .calibrationFolds(properties.getCalibrationFolds())
            .seed(properties.getRandomSeed())
            .build();
        artifactStore = new ArtifactStore();
        pipeline = new TrainingPipeline(properties, FeatureSchema.lungCancer(), new CsvDatasetLoader(),
            new DatasetEncoder(), new CalibratedClassifierTrainer(settings), new ModelEvaluator(), artifactStore);
    }

    private Path writeDataset(int rows, long seed) throws IOException {
        Random random = new Random(seed);
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (int r = 0; r < rows; r++) {
            int age = 35 + random.nextInt(50);
            double packYears = Math.round(random.nextDouble() * 600) / 10.0;
            boolean copd = random.nextDouble() < 0.3;
            double risk = (age - 35) / 50.0 * 0.4 + packYears / 60.0 * 0.3 + (copd ? 0.25 : 0.0);
            csv.append(r).append(',')
                .append(age).append(',')
                .append(random.nextBoolean() ? "Male" : "Female").append(',')
                .append(packYears).append(',')
                .append(random.nextDouble() < 0.2 ? "High" : "Low").append(',')
                .append(random.nextBoolean() ? "Yes" : "No").append(',')
                .append(random.nextBoolean() ? "Yes" : "No").append(',')
                .append(copd ? "Yes" : "No").append(',')
                .append(random.nextDouble() < 0.5 ? "Moderate" : "None").append(',')
                .append(random.nextDouble() < 0.25 ? "Yes" : "No").append(',')
                .append(random.nextDouble() < risk ? "Yes" : "No").append('\n');
        }
        Path file = workDir.resolve("lung_cancer_dataset.csv");
        Files.writeString(file, csv);
        return file;
    }

    @Nested
    @DisplayName("Successful run")
    class SuccessfulRun {

        @Test
        @DisplayName("Should write a bundle the scoring side can load")
        void shouldPersistLoadableArtifacts() throws Exception {
            Path source = writeDataset(300, 5L);
            Path output = workDir.resolve("artifacts");

            TrainingReport report = pipeline.run(source, output);

            assertThat(output.resolve(ArtifactStore.SCALER_FILE)).exists();
            assertThat(output.resolve(ArtifactStore.MODEL_FILE)).exists();
            assertThat(output.resolve(ArtifactStore.METADATA_FILE)).exists();
            assertThat(report.getTrainingRows() + report.getTestRows()).isEqualTo(300);
            assertThat(report.getTestRows()).isBetween(58, 62);

            ArtifactBundle bundle = artifactStore.load(output);
            assertThat(bundle.getTrainingPrior()).isEqualTo(report.getMetadata().getPiTrain()).isBetween(0.0, 1.0);
            assertThat(bundle.getMetadata().getCalibrationMethod()).isEqualTo("isotonic");
            assertThat(bundle.getMetadata().getMetrics()).containsKeys("roc_auc", "brier");
            assertThat(bundle.getMetadata().getVersions()).containsKey("weka");
            assertThat(bundle.getMetadata().getTrainingDataSourceIdentifier()).endsWith("lung_cancer_dataset.csv");

            double risk = bundle.getModel().score(bundle.getScaling().transform(
                bundle.getSchema().getFeatureOrder(),
                bundle.getEncoder().encode(Map.of("age", 80, "pack_years", 55, "copd_diagnosis", "yes")).getValues()));
            assertThat(risk).isBetween(0.0, 1.0);
        }

        @Test
        void scalerShouldCoverNumericColumnsOnly() throws Exception {
            Path source = writeDataset(200, 9L);
            Path output = workDir.resolve("artifacts");

            pipeline.run(source, output);

            ArtifactBundle bundle = artifactStore.load(output);
            assertThat(bundle.getScaling().getColumns()).containsExactly("age", "pack_years");
            assertThat(bundle.getScaling().meanOf("age")).isBetween(35.0, 85.0);
        }
    }

    @Nested
    @DisplayName("Aborted run")
    class AbortedRun {

        @Test
        @DisplayName("Should name every missing column and write nothing")
        void shouldAbortOnMissingColumns() throws Exception {
            Path source = workDir.resolve("partial.csv");
            Files.writeString(source, "age,gender,lung_cancer\n60,Male,Yes\n50,Female,No\n");
            Path output = workDir.resolve("artifacts");

            SchemaValidationException error = catchThrowableOfType(
                () -> pipeline.run(source, output), SchemaValidationException.class);

            assertThat(error.getStage()).isEqualTo(TrainingStage.VALIDATE_COLUMNS);
            assertThat(error.getMissingColumns()).contains("pack_years", "copd_diagnosis", "family_history")
                .doesNotContain("age", "gender");
            assertThat(output).doesNotExist();
        }

        @Test
        void shouldAbortWhenLabelHasOneClass() throws Exception {
            Path source = workDir.resolve("negatives.csv");
            StringBuilder csv = new StringBuilder(HEADER).append('\n');
            for (int r = 0; r < 20; r++) {
                csv.append(r).append(",60,Male,10,Low,No,No,No,None,No,No\n");
            }
            Files.writeString(source, csv);

            assertThatThrownBy(() -> pipeline.run(source, workDir.resolve("artifacts")))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("ENCODE_LABELS_AND_FEATURES")
                .hasMessageContaining("both classes");
        }

        @Test
        void shouldAbortAtLoadStageForMissingFile() {
            TrainingException error = catchThrowableOfType(
                () -> pipeline.run(workDir.resolve("missing.csv"), workDir.resolve("artifacts")),
                TrainingException.class);

            assertThat(error.getStage()).isEqualTo(TrainingStage.LOAD_DATA);
        }

        @Test
        void shouldAbortWhenMinorityClassIsTooSmallForCalibration() throws Exception {
            Path source = workDir.resolve("rare.csv");
            StringBuilder csv = new StringBuilder(HEADER).append('\n');
            for (int r = 0; r < 40; r++) {
                csv.append(r).append(",60,Male,10,Low,No,No,No,None,No,").append(r < 3 ? "Yes" : "No").append('\n');
            }
            Files.writeString(source, csv);

            TrainingException error = catchThrowableOfType(
                () -> pipeline.run(source, workDir.resolve("artifacts")), TrainingException.class);

            assertThat(error.getStage()).isEqualTo(TrainingStage.FIT_CALIBRATED_CLASSIFIER);
        }
    }
}
