package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * The five canonical facts the decision policy and the email drafter work from.
 *
 * @param amountDelta absolute invoice/PO amount difference
 * @param daysDelta   invoice date minus PO date, in days
 */
@Schema(description = "Canonical facts about an invoice / PO pair")
public record MatchFacts(
    double amountDelta,
    boolean vendorMatch,
    boolean poMissing,
    boolean hasGrn,
    double daysDelta
) {

    private static final MatchFacts DEFAULTS = new MatchFacts(0.0, true, false, true, 0.0);

    /**
     * Safe values used whenever facts are absent: vendor matches, GRN present,
     * PO found, no amount or timing difference.
     */
    public static MatchFacts defaults() {
        return DEFAULTS;
    }

    public static MatchFacts orDefaults(MatchFacts facts) {
        return facts != null ? facts : DEFAULTS;
    }

    public static MatchFacts of(FeatureVector row) {
        return new MatchFacts(
                row.getAmountDeltaAbs(),
                row.isVendorMatch(),
                row.isPoMissing(),
                row.isHasGrn(),
                row.getDaysDelta()
        );
    }
}
