package com.lungrisk.scoring.dto;

import com.lungrisk.common.feature.BinaryFeatureSemantics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadataResponse {

    private List<String> featureOrder;
    private List<String> numericCols;
    private List<String> binaryCols;
    private Map<String, BinaryFeatureSemantics> binaryMeaning;
    private String target;
    private String calibrationMethod;
    private String modelFamily;
    private Double piTrain;
    private Double piDeployDefault;
    private String trainingDataSource;
    private Instant createdAt;
    private Double bestThreshold;
    private Map<String, Double> metrics;
}
