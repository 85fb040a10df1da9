package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Request to train the mismatch classifier. Every field falls back to configuration.
 */
@Schema(description = "Request to train the mismatch classifier")
public record TrainingRequest(

    @Schema(description = "Directory holding the three record sets", example = "./data")
    String dataDir,

    @Schema(description = "Directory receiving the model, metrics and feature table", example = "./reports")
    String outputDir,

    @Schema(description = "Apply synthetic corruption for offline evaluation datasets")
    Boolean syntheticCorruption
) {}
