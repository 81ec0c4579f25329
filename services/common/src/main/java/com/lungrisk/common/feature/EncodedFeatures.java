package com.lungrisk.common.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A feature vector in schema order, before scaling, together with the parsed values
 * echoed back to callers so they can see how their input was interpreted.
 */
public final class EncodedFeatures {

    private final List<String> featureOrder;
    private final double[] values;
    private final Map<String, Object> inputsUsed;

    EncodedFeatures(List<String> featureOrder, double[] values, Map<String, Object> inputsUsed) {
        this.featureOrder = featureOrder;
        this.values = values;
        this.inputsUsed = Collections.unmodifiableMap(new LinkedHashMap<>(inputsUsed));
    }

    public List<String> getFeatureOrder() {
        return featureOrder;
    }

    public double[] getValues() {
        return values.clone();
    }

    public double valueOf(String feature) {
        int index = featureOrder.indexOf(feature);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature: " + feature);
        }
        return values[index];
    }

    public Map<String, Object> getInputsUsed() {
        return inputsUsed;
    }
}
