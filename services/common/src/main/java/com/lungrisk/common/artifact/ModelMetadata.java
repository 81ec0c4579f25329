package com.lungrisk.common.artifact;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lungrisk.common.exception.ArtifactIntegrityException;
import com.lungrisk.common.feature.BinaryFeatureSemantics;
import com.lungrisk.common.feature.FeatureSchema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code meta.json} document written next to the scaler and classifier.
 * Carries everything serving needs to reproduce training-time encoding, plus
 * provenance and the evaluation report of the run that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelMetadata {

    private Double piTrain;
    private List<String> featureOrder;
    private List<String> numericCols;
    private List<String> binaryCols;
    private Map<String, BinaryFeatureSemantics> binaryMeaning;
    private String target;
    private String calibrationMethod;
    private String modelFamily;
    private String trainingDataSourceIdentifier;
    private Instant createdAt;
    private Long randomSeed;
    private Double bestThreshold;
    private Map<String, Double> metrics;
    private Map<String, String> versions;

    /**
     * Metadata pre-filled with the feature contract of {@code schema}.
     */
    public static ModelMetadataBuilder forSchema(FeatureSchema schema) {
        return ModelMetadata.builder()
            .featureOrder(schema.getFeatureOrder())
            .numericCols(schema.getNumericColumns())
            .binaryCols(schema.getBinaryColumns())
            .binaryMeaning(new LinkedHashMap<>(schema.getBinarySemantics()))
            .target(schema.getTarget());
    }

    /**
     * Rebuilds the feature contract, rejecting documents whose column lists disagree.
     */
    public FeatureSchema toSchema() {
        if (featureOrder == null || numericCols == null) {
            throw new ArtifactIntegrityException("Metadata must define featureOrder and numericCols");
        }
        Map<String, BinaryFeatureSemantics> meanings = new LinkedHashMap<>();
        for (String feature : featureOrder) {
            if (!numericCols.contains(feature)) {
                BinaryFeatureSemantics meaning = binaryMeaning == null ? null : binaryMeaning.get(feature);
                meanings.put(feature, meaning != null ? meaning : BinaryFeatureSemantics.yesNo());
            }
        }
        FeatureSchema schema = new FeatureSchema(featureOrder, numericCols, meanings,
            target != null ? target : FeatureSchema.LUNG_CANCER);
        if (binaryCols != null && !binaryCols.equals(schema.getBinaryColumns())) {
            throw new ArtifactIntegrityException("Metadata binaryCols " + binaryCols
                + " disagree with featureOrder minus numericCols " + schema.getBinaryColumns());
        }
        return schema;
    }
}
