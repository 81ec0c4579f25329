package com.lungrisk.common.feature;

import com.lungrisk.common.exception.ArtifactIntegrityException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fixed feature contract shared by training and serving: feature order, which
 * columns are numeric, the meaning of every binary column, and the label column.
 *
 * <p>Established once at training time and persisted with the model; serving
 * rebuilds it from the metadata document and never reorders it.
 */
@Getter
public final class FeatureSchema {

    public static final String AGE = "age";
    public static final String PACK_YEARS = "pack_years";
    public static final String GENDER = "gender";
    public static final String RADON_EXPOSURE = "radon_exposure";
    public static final String ASBESTOS_EXPOSURE = "asbestos_exposure";
    public static final String SECONDHAND_SMOKE_EXPOSURE = "secondhand_smoke_exposure";
    public static final String COPD_DIAGNOSIS = "copd_diagnosis";
    public static final String ALCOHOL_CONSUMPTION = "alcohol_consumption";
    public static final String FAMILY_HISTORY = "family_history";
    public static final String LUNG_CANCER = "lung_cancer";

    private final List<String> featureOrder;
    private final List<String> numericColumns;
    private final Map<String, BinaryFeatureSemantics> binarySemantics;
    private final String target;

    public FeatureSchema(List<String> featureOrder,
                         List<String> numericColumns,
                         Map<String, BinaryFeatureSemantics> binarySemantics,
                         String target) {
        this.featureOrder = List.copyOf(featureOrder);
        this.numericColumns = List.copyOf(numericColumns);
        this.binarySemantics = Collections.unmodifiableMap(new LinkedHashMap<>(binarySemantics));
        this.target = target;
        verify();
    }

    /**
     * Schema of the lung cancer model: two numeric exposures followed by seven indicators.
     */
    public static FeatureSchema lungCancer() {
        Map<String, BinaryFeatureSemantics> semantics = new LinkedHashMap<>();
        semantics.put(GENDER, BinaryFeatureSemantics.of("Male", "Female", "male", "m"));
        semantics.put(RADON_EXPOSURE, BinaryFeatureSemantics.of("High", "Low or Medium", "high"));
        semantics.put(ASBESTOS_EXPOSURE, BinaryFeatureSemantics.yesNo());
        semantics.put(SECONDHAND_SMOKE_EXPOSURE, BinaryFeatureSemantics.yesNo());
        semantics.put(COPD_DIAGNOSIS, BinaryFeatureSemantics.yesNo());
        semantics.put(ALCOHOL_CONSUMPTION,
            BinaryFeatureSemantics.of("Moderate or Heavy", "None", "moderate", "heavy"));
        semantics.put(FAMILY_HISTORY, BinaryFeatureSemantics.yesNo());

        List<String> order = new ArrayList<>(List.of(AGE, PACK_YEARS));
        order.addAll(semantics.keySet());
        return new FeatureSchema(order, List.of(AGE, PACK_YEARS), semantics, LUNG_CANCER);
    }

    public List<String> getBinaryColumns() {
        return featureOrder.stream()
            .filter(name -> !numericColumns.contains(name))
            .toList();
    }

    public boolean isNumeric(String feature) {
        return numericColumns.contains(feature);
    }

    public BinaryFeatureSemantics semanticsOf(String feature) {
        return binarySemantics.getOrDefault(feature, BinaryFeatureSemantics.yesNo());
    }

    /**
     * Every column the training source must provide: all features plus the label.
     */
    public List<String> requiredColumns() {
        List<String> columns = new ArrayList<>(featureOrder);
        columns.add(target);
        return columns;
    }

    private void verify() {
        if (featureOrder.isEmpty()) {
            throw new ArtifactIntegrityException("Feature order is empty");
        }
        Set<String> seen = new HashSet<>();
        for (String feature : featureOrder) {
            if (!seen.add(feature)) {
                throw new ArtifactIntegrityException("Feature order lists '" + feature + "' twice");
            }
        }
        for (String numeric : numericColumns) {
            if (!seen.contains(numeric)) {
                throw new ArtifactIntegrityException(
                    "Numeric column '" + numeric + "' is not part of the feature order " + featureOrder);
            }
        }
        for (String binary : binarySemantics.keySet()) {
            if (!seen.contains(binary) || numericColumns.contains(binary)) {
                throw new ArtifactIntegrityException(
                    "Binary column '" + binary + "' is not a non-numeric member of the feature order");
            }
        }
        if (target == null || seen.contains(target)) {
            throw new ArtifactIntegrityException("Target column must be set and distinct from the features");
        }
    }
}
