package com.acme.reconcile.service;

import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchIssue;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Turns a mismatch probability and the pair's facts into a business verdict.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>any material issue (PO missing, vendor mismatch, amount difference above 0.01,
 *       no goods receipt): mismatch with the model probability as confidence</li>
 *   <li>probability at least 0.8: mismatch</li>
 *   <li>probability at least 0.6: partial</li>
 *   <li>otherwise: match with confidence {@code 1 - probability}</li>
 * </ol>
 * Pure: equal inputs always give equal verdicts and explanations.
 */
@Component
public class DecisionPolicy {

    static final double MISMATCH_THRESHOLD = 0.8;
    static final double PARTIAL_THRESHOLD = 0.6;

    public MatchResult decide(double mismatchProbability, MatchFacts facts) {
        MatchFacts effective = MatchFacts.orDefaults(facts);
        double p = clamp(mismatchProbability);

        MatchStatus status;
        double confidence;
        if (hasMaterialIssue(effective)) {
            status = MatchStatus.MISMATCH;
            confidence = p;
        } else if (p >= MISMATCH_THRESHOLD) {
            status = MatchStatus.MISMATCH;
            confidence = p;
        } else if (p >= PARTIAL_THRESHOLD) {
            status = MatchStatus.PARTIAL;
            confidence = p;
        } else {
            status = MatchStatus.MATCH;
            confidence = 1.0 - p;
        }

        return new MatchResult(status, confidence, effective, explain(effective, status, confidence));
    }

    static boolean hasMaterialIssue(MatchFacts facts) {
        return facts.poMissing()
                || !facts.vendorMatch()
                || Math.abs(facts.amountDelta()) > MatchIssue.AMOUNT_TOLERANCE
                || !facts.hasGrn();
    }

    /**
     * Builds the explanation sentence for a verdict.
     */
    public static String explain(MatchFacts facts, MatchStatus status, double confidence) {
        MatchFacts effective = MatchFacts.orDefaults(facts);
        List<MatchIssue> issues = MatchIssue.detect(effective);
        String joined = issues.stream()
                .map(issue -> issue.describe(effective))
                .collect(Collectors.joining("; "));
        String conf = String.format(Locale.ROOT, "%.2f", confidence);

        return switch (status) {
            case MISMATCH -> issues.isEmpty()
                    ? "Model detected potential mismatch (confidence: " + conf + "). Manual review recommended."
                    : "Mismatch detected: " + joined + ". Confidence: " + conf;
            case PARTIAL -> "Uncertain match requiring review (confidence: " + conf + "). "
                    + (issues.isEmpty() ? "Model suggests possible issues." : joined);
            case MATCH -> issues.isEmpty()
                    ? "Clean match with no material differences. Confidence: " + conf
                    : "Match confirmed despite minor issues: " + joined + ". Confidence: " + conf;
        };
    }

    private static double clamp(double probability) {
        if (Double.isNaN(probability)) {
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, probability));
    }
}
