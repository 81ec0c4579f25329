package com.lungrisk.common.artifact;

import com.lungrisk.common.exception.ArtifactIntegrityException;
import com.lungrisk.common.feature.FeatureEncoder;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.model.ProbabilityModel;
import com.lungrisk.common.scaling.ScalingStatistics;
import lombok.Getter;

import java.util.List;

/**
 * Immutable set of artifacts that fully determines serving behaviour for one model
 * version. Built once at startup and shared read-only by all requests.
 */
@Getter
public final class ArtifactBundle {

    private final FeatureSchema schema;
    private final ScalingStatistics scaling;
    private final ProbabilityModel model;
    private final ModelMetadata metadata;
    private final FeatureEncoder encoder;

    private ArtifactBundle(FeatureSchema schema, ScalingStatistics scaling,
                           ProbabilityModel model, ModelMetadata metadata) {
        this.schema = schema;
        this.scaling = scaling;
        this.model = model;
        this.metadata = metadata;
        this.encoder = new FeatureEncoder(schema);
    }

    /**
     * Cross-checks the three artifacts and assembles the bundle.
     *
     * @throws ArtifactIntegrityException if scaler columns, classifier features and
     *                                    metadata feature order do not line up
     */
    public static ArtifactBundle assemble(ScalingStatistics scaling, ProbabilityModel model, ModelMetadata metadata) {
        FeatureSchema schema = metadata.toSchema();

        List<String> scaledColumns = scaling.getColumns();
        if (!scaledColumns.equals(schema.getNumericColumns())) {
            throw new ArtifactIntegrityException("Scaler columns " + scaledColumns
                + " do not match metadata numeric columns " + schema.getNumericColumns());
        }
        List<String> modelFeatures = model.getFeatureNames();
        if (!modelFeatures.equals(schema.getFeatureOrder())) {
            throw new ArtifactIntegrityException("Classifier was trained on features " + modelFeatures
                + " but metadata feature order is " + schema.getFeatureOrder());
        }
        return new ArtifactBundle(schema, scaling, model, metadata);
    }

    public Double getTrainingPrior() {
        return metadata.getPiTrain();
    }
}
