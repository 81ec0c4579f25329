package com.lungrisk.scoring.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Scoring service configuration (lungrisk.scoring.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "lungrisk.scoring")
public class ScoringProperties {

    /**
     * Directory holding scaler.bin, model.bin and meta.json
     */
    @NotBlank
    private String artifactDirectory = "./artifacts";

    @Valid
    private Prevalence prevalence = new Prevalence();

    @Data
    public static class Prevalence {

        /**
         * Replaces the training prior recorded in meta.json when it parses to a value in (0, 1)
         */
        private String trainingOverride;

        /**
         * Deployment prior used when a request does not supply one
         */
        private String deploymentDefault;
    }
}
