package com.lungrisk.training.data;

import com.lungrisk.common.feature.EncodedFeatures;
import com.lungrisk.common.feature.FeatureEncoder;
import com.lungrisk.common.feature.FeatureParser;
import com.lungrisk.common.feature.FeatureSchema;
import com.lungrisk.common.feature.FeatureValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Encodes text rows with the same tolerant encoder the scoring service uses, so
 * training and serving interpret values identically.
 */
@Slf4j
@Component
public class DatasetEncoder {

    public LabeledDataset encode(RawDataset dataset, FeatureSchema schema) {
        FeatureEncoder encoder = new FeatureEncoder(schema);
        List<Map<String, String>> rows = dataset.getRows();
        double[][] features = new double[rows.size()][];
        int[] labels = new int[rows.size()];
        int blankNumerics = 0;
        int unrecognizedLabels = 0;

        for (int r = 0; r < rows.size(); r++) {
            Map<String, String> row = rows.get(r);
            EncodedFeatures encoded = encoder.encode(row);
            features[r] = encoded.getValues();
            FeatureValue label = FeatureValue.of(row.get(schema.getTarget()));
            labels[r] = FeatureParser.parseBinary(label, Set.of());
            if (!FeatureParser.isRecognizedBinary(label, Set.of())) {
                unrecognizedLabels++;
            }
            for (String numeric : schema.getNumericColumns()) {
                String cell = row.get(numeric);
                if (cell == null || cell.isBlank()) {
                    blankNumerics++;
                }
            }
        }
        if (blankNumerics > 0) {
            log.warn("{} blank numeric cells were encoded as {}", blankNumerics, FeatureParser.DEFAULT_NUMERIC);
        }
        if (unrecognizedLabels > 0) {
            log.warn("{} of {} '{}' labels are blank or unrecognised and were encoded as 0; the training prior may be understated",
                unrecognizedLabels, rows.size(), schema.getTarget());
        }
        LabeledDataset labeled = new LabeledDataset(schema.getFeatureOrder(), features, labels, unrecognizedLabels);
        log.info("Encoded {} rows: {} positive ({}%)", labeled.size(), labeled.positiveCount(),
            String.format("%.2f", labeled.positiveRate() * 100.0));
        return labeled;
    }
}
