package com.acme.reconcile.ml;

/**
 * A freshly fitted model together with its held-out evaluation.
 */
public record TrainingOutcome(TrainedModel model, TrainingMetrics metrics) {}
