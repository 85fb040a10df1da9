package com.acme.reconcile.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Output of the inference entry point for a single pair.
 * <p>
 * {@code status} is the model-only verdict (mismatch when the probability reaches 0.5)
 * and {@code confidence} is the raw probability of mismatch. The business verdict is
 * produced afterwards by the decision policy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Model score for an invoice / PO pair")
public record ScoreResult(

    @Schema(description = "Whether a feature row exists for the pair")
    boolean found,

    @Schema(description = "Model-only verdict", example = "match")
    MatchStatus status,

    @Schema(description = "Probability of mismatch", example = "0.2")
    Double confidence,

    @Schema(description = "Canonical facts for the pair")
    MatchFacts facts,

    @Schema(description = "Reason when the pair was not found")
    String message
) {

    public static final double MODEL_THRESHOLD = 0.5;

    public static ScoreResult found(double probability, MatchFacts facts) {
        MatchStatus status = probability >= MODEL_THRESHOLD ? MatchStatus.MISMATCH : MatchStatus.MATCH;
        return new ScoreResult(true, status, probability, facts, null);
    }

    public static ScoreResult notFound(String message) {
        return new ScoreResult(false, null, null, null, message);
    }
}
