package com.lungrisk.scoring.dto;

import com.lungrisk.scoring.service.PredictionResult;
import com.lungrisk.scoring.service.RiskPercentages;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Risk estimate returned to callers. {@code riskPercentage} is the adjusted figure
 * when a prevalence correction was applied and the raw figure otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionResponse {

    private BigDecimal riskPercentage;
    private BigDecimal rawRiskPercentage;
    private BigDecimal adjustedRiskPercentage;
    private boolean adjustedForPrevalence;
    private Double priorTraining;
    private Double priorDeployment;
    private Map<String, Object> inputsUsed;

    public static PredictionResponse from(PredictionResult result) {
        return PredictionResponse.builder()
            .riskPercentage(RiskPercentages.toPercentage(result.getEffectiveProbability()))
            .rawRiskPercentage(RiskPercentages.toPercentage(result.getRawProbability()))
            .adjustedRiskPercentage(RiskPercentages.toPercentage(result.getAdjustedProbability()))
            .adjustedForPrevalence(result.isUsedAdjustment())
            .priorTraining(result.getTrainingPrior())
            .priorDeployment(result.getDeploymentPrior())
            .inputsUsed(result.getInputsUsed())
            .build();
    }
}
