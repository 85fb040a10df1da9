package com.acme.reconcile.service;

import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.domain.ScoreResult;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * The matcher capability: scores a pair and applies the decision policy.
 * A pair with no feature row becomes a low-confidence partial result rather than an error.
 */
@Component
public class InvoiceMatcher {

    static final double NOT_FOUND_CONFIDENCE = 0.5;
    static final String NOT_FOUND_EXPLANATION = "No features available for this pair.";

    private final InvoiceScorer scorer;
    private final DecisionPolicy policy;

    public InvoiceMatcher(InvoiceScorer scorer, DecisionPolicy policy) {
        this.scorer = scorer;
        this.policy = policy;
    }

    public MatchResult match(String invoiceId, String poNumber, String dataDir, String modelPath) {
        ScoreResult score = scorer.score(Path.of(dataDir), Path.of(modelPath), invoiceId, poNumber);
        if (!score.found()) {
            return new MatchResult(MatchStatus.PARTIAL, NOT_FOUND_CONFIDENCE, MatchFacts.defaults(),
                    NOT_FOUND_EXPLANATION);
        }
        return policy.decide(score.confidence(), score.facts());
    }
}
