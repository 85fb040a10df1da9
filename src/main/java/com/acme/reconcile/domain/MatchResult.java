package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Business verdict for one pair, with the facts it was derived from.
 */
@Schema(description = "Reconciliation verdict for an invoice / PO pair")
public record MatchResult(

    @Schema(description = "Verdict", example = "match")
    MatchStatus status,

    @Schema(description = "Confidence in the verdict, between 0 and 1", example = "0.8")
    double confidence,

    @Schema(description = "Facts the verdict is based on")
    MatchFacts facts,

    @Schema(description = "Human-readable explanation")
    String explanation
) {

    public MatchResult {
        facts = MatchFacts.orDefaults(facts);
    }
}
