package com.lungrisk.scoring.controller;

import com.lungrisk.common.prevalence.PrevalencePolicy;
import com.lungrisk.scoring.dto.ModelMetadataResponse;
import com.lungrisk.scoring.dto.PredictionResponse;
import com.lungrisk.scoring.service.PredictionResult;
import com.lungrisk.scoring.service.RiskScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Risk prediction API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RiskPredictionController {

    private final RiskScoringService riskScoringService;

    /**
     * Scores a patient. Attribute values may be numbers, booleans or strings; anything
     * unparseable is read as 0 / "no". {@code pi_deploy} overrides the configured
     * deployment prevalence for this request.
     */
    @PostMapping("/predict")
    public ResponseEntity<PredictionResponse> predict(
            @RequestBody(required = false) Map<String, Object> attributes,
            @RequestParam(name = "pi_deploy", required = false) String piDeploy) {

        PredictionResult result = riskScoringService.predict(
            attributes == null ? Map.of() : attributes, parsePrior(piDeploy));
        return ResponseEntity.ok(PredictionResponse.from(result));
    }

    @GetMapping("/metadata")
    public ResponseEntity<ModelMetadataResponse> metadata() {
        return ResponseEntity.ok(riskScoringService.describeModel());
    }

    /**
     * Blank means "not supplied". Unparseable text becomes NaN, which the adjuster
     * treats as an invalid prior, so the request is still scored without correction.
     */
    static Double parsePrior(String value) {
        Double prior = PrevalencePolicy.parsePrior(value);
        if (prior != null && prior.isNaN()) {
            log.debug("Ignoring unparseable pi_deploy '{}'", value);
        }
        return prior;
    }
}
