package com.acme.reconcile.domain;

import com.acme.reconcile.ml.TrainingMetrics;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * What a training run produced and where it was written.
 */
@Schema(description = "Outcome of a training run")
public record TrainingReport(
    TrainingMetrics metrics,
    String modelPath,
    String metricsPath,
    String featuresPath,
    int labelledRows,
    boolean syntheticCorruption
) {}
