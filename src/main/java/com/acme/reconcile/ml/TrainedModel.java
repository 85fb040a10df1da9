package com.acme.reconcile.ml;

import com.acme.reconcile.domain.FeatureVector;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Persisted logistic-regression artifact.
 * <p>
 * {@code featureList} is the exact, ordered list of columns the model was trained on;
 * {@code coefficients} are aligned with it. Artifacts written before the schema carried a
 * version are migrated on load (see {@link ModelArtifactStore}).
 */
public record TrainedModel(
    int schemaVersion,
    List<String> featureList,
    double[] coefficients,
    double intercept,
    OffsetDateTime trainedAt
) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public TrainedModel {
        featureList = List.copyOf(featureList);
        if (coefficients.length != featureList.size()) {
            throw new IllegalArgumentException("Model has " + coefficients.length
                    + " coefficients for " + featureList.size() + " features");
        }
        coefficients = coefficients.clone();
    }

    /**
     * Probability that the pair is a mismatch, in [0, 1].
     */
    public double predictProba(FeatureVector row) {
        double z = intercept;
        for (int i = 0; i < featureList.size(); i++) {
            z += coefficients[i] * row.value(featureList.get(i));
        }
        double p = 1.0 / (1.0 + Math.exp(-z));
        if (Double.isNaN(p)) {
            return 0.5;
        }
        return Math.min(1.0, Math.max(0.0, p));
    }
}
