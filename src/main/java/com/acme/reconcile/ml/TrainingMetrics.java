package com.acme.reconcile.ml;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Evaluation report of a training run, measured on the held-out split.
 * Serialized with snake_case keys into {@code metrics.json}.
 */
public record TrainingMetrics(

    @JsonProperty("precision_pos")
    double precisionPos,

    @JsonProperty("recall_pos")
    double recallPos,

    @JsonProperty("f1_pos")
    double f1Pos,

    @JsonProperty("accuracy")
    double accuracy,

    @JsonProperty("report")
    Map<String, ClassMetrics> report,

    @JsonProperty("threshold")
    double threshold,

    @JsonProperty("feature_importance")
    Map<String, Double> featureImportance,

    @JsonProperty("features_used")
    List<String> featuresUsed,

    @JsonProperty("n_features")
    int nFeatures,

    @JsonProperty("class_distribution")
    Map<String, Integer> classDistribution,

    @JsonProperty("train_size")
    int trainSize,

    @JsonProperty("test_size")
    int testSize
) {

    /**
     * Per-class breakdown.
     */
    public record ClassMetrics(
        @JsonProperty("precision") double precision,
        @JsonProperty("recall") double recall,
        @JsonProperty("f1") double f1,
        @JsonProperty("support") int support
    ) {}
}
