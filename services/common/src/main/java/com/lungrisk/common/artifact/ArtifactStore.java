package com.lungrisk.common.artifact;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lungrisk.common.exception.ArtifactIntegrityException;
import com.lungrisk.common.exception.ArtifactLoadException;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.model.CalibratedClassifier;
import com.lungrisk.common.model.ProbabilityModel;
import com.lungrisk.common.scaling.ScalingStatistics;
import lombok.extern.slf4j.Slf4j;
import weka.core.SerializationHelper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the artifact bundle directory:
 * <ul>
 *   <li>{@value #SCALER_FILE} - serialized {@link ScalingStatistics}</li>
 *   <li>{@value #MODEL_FILE} - serialized {@link CalibratedClassifier}</li>
 *   <li>{@value #METADATA_FILE} - {@link ModelMetadata} as JSON</li>
 * </ul>
 * The scaler and classifier are mandatory. A missing metadata document falls back to
 * the built-in lung cancer schema with no recorded training prior.
 */
@Slf4j
public class ArtifactStore {

    public static final String SCALER_FILE = "scaler.bin";
    public static final String MODEL_FILE = "model.bin";
    public static final String METADATA_FILE = "meta.json";

    private final ObjectMapper objectMapper;

    public ArtifactStore() {
        this(defaultObjectMapper());
    }

    public ArtifactStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void save(Path directory, ScalingStatistics scaling, ProbabilityModel model,
                     ModelMetadata metadata) throws IOException {
        Files.createDirectories(directory);
        writeObject(directory.resolve(SCALER_FILE), scaling);
        writeObject(directory.resolve(MODEL_FILE), model);
        objectMapper.writerWithDefaultPrettyPrinter()
            .writeValue(directory.resolve(METADATA_FILE).toFile(), metadata);
        log.info("Saved model artifacts to {}", directory.toAbsolutePath());
    }

    public ArtifactBundle load(Path directory) {
        Path scalerPath = directory.resolve(SCALER_FILE);
        Path modelPath = directory.resolve(MODEL_FILE);
        Path metadataPath = directory.resolve(METADATA_FILE);

        List<String> missing = new ArrayList<>();
        if (!Files.isRegularFile(scalerPath)) {
            missing.add(SCALER_FILE);
        }
        if (!Files.isRegularFile(modelPath)) {
            missing.add(MODEL_FILE);
        }
        if (!missing.isEmpty()) {
            throw ArtifactLoadException.missingFiles(directory, missing);
        }

        ScalingStatistics scaling = readObject(scalerPath, ScalingStatistics.class);
        ProbabilityModel model = readObject(modelPath, ProbabilityModel.class);
        ModelMetadata metadata = readMetadata(metadataPath);

        ArtifactBundle bundle = ArtifactBundle.assemble(scaling, model, metadata);
        log.info("Loaded model artifacts from {}: family={}, calibration={}, features={}, piTrain={}",
            directory.toAbsolutePath(), model.getModelFamily(), model.getCalibrationMethod(),
            bundle.getSchema().getFeatureOrder(), metadata.getPiTrain());
        return bundle;
    }

    private ModelMetadata readMetadata(Path metadataPath) {
        if (!Files.isRegularFile(metadataPath)) {
            log.warn("{} not found; assuming the default lung cancer schema and no training prior", metadataPath);
            return ModelMetadata.forSchema(FeatureSchema.lungCancer()).build();
        }
        try {
            return objectMapper.readValue(metadataPath.toFile(), ModelMetadata.class);
        } catch (IOException e) {
            throw new ArtifactLoadException("Failed to read " + metadataPath.getFileName(), e);
        }
    }

    private static <T> T readObject(Path path, Class<T> expectedType) {
        Object value;
        try {
            value = SerializationHelper.read(path.toString());
        } catch (Exception e) {
            throw new ArtifactLoadException("Failed to read " + path.getFileName(), e);
        }
        if (!expectedType.isInstance(value)) {
            String found = value == null ? "no object" : value.getClass().getName();
            throw new ArtifactIntegrityException(path.getFileName() + " contains "
                + found + ", expected " + expectedType.getSimpleName());
        }
        return expectedType.cast(value);
    }

    private static void writeObject(Path path, Object value) throws IOException {
        try {
            SerializationHelper.write(path.toString(), value);
        } catch (Exception e) {
            throw new IOException("Failed to write " + path.getFileName(), e);
        }
    }
}
