package com.lungrisk.common.feature;

import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a loosely-typed attribute map into a vector ordered by the schema.
 * Missing attributes take parser defaults; insertion order of the input is ignored.
 */
@RequiredArgsConstructor
public class FeatureEncoder {

    private final FeatureSchema schema;

    public EncodedFeatures encode(Map<String, ?> rawAttributes) {
        List<String> order = schema.getFeatureOrder();
        double[] values = new double[order.size()];
        Map<String, Object> inputsUsed = new LinkedHashMap<>();

        for (int i = 0; i < order.size(); i++) {
            String feature = order.get(i);
            FeatureValue raw = FeatureValue.of(rawAttributes == null ? null : rawAttributes.get(feature));
            if (schema.isNumeric(feature)) {
                double number = FeatureParser.parseNumeric(raw, FeatureParser.DEFAULT_NUMERIC);
                values[i] = number;
                inputsUsed.put(feature, number);
            } else {
                int flag = FeatureParser.parseBinary(raw, schema.semanticsOf(feature).normalizedAliases());
                values[i] = flag;
                inputsUsed.put(feature, flag);
            }
        }
        return new EncodedFeatures(order, values, inputsUsed);
    }
}
