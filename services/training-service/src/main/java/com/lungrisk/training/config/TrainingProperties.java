package com.lungrisk.training.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Training job configuration (lungrisk.training.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "lungrisk.training")
public class TrainingProperties {

    /**
     * CSV file with one row per patient, feature columns and the lung_cancer label
     */
    @NotBlank
    private String dataSource = "lung_cancer_dataset.csv";

    /**
     * Where scaler.bin, model.bin and meta.json are written
     */
    @NotBlank
    private String outputDirectory = "./artifacts";

    @DecimalMin("0.05")
    @DecimalMax("0.5")
    private double testFraction = 0.2;

    @Min(2)
    private int calibrationFolds = 5;

    private long randomSeed = 42L;

    @Min(1)
    private int numTrees = 200;

    /**
     * 0 for unlimited
     */
    @Min(0)
    private int maxDepth = 0;

    @Min(1)
    private int executionSlots = 1;

    /**
     * Run the pipeline as soon as the application starts
     */
    private boolean runOnStartup = true;
}
