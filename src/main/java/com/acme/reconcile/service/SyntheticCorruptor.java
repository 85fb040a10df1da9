package com.acme.reconcile.service;

import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LabelledExample;
import com.acme.reconcile.domain.LabelledMismatch;
import com.acme.reconcile.domain.LinkedPair;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Injects synthetic noise into offline evaluation datasets.
 * <p>
 * Only the training entry point calls this, and only when synthetic corruption is requested.
 * Scoring and orchestration never reach it. Every step draws from its own generator seeded
 * from {@code reconcile.synthetic.seed}, independent of the training split seed.
 */
@Component
@Slf4j
public class SyntheticCorruptor {

    static final double DROPPED_LINK_RATE = 0.15;
    static final double MISSING_GRN_RATE = 0.15;
    static final double EXTRA_MISSING_PO_RATE = 0.05;
    static final double CURRENCY_MISMATCH_RATE = 0.05;
    static final int MAX_VENDOR_ANOMALIES = 8;
    static final int MAX_CURRENCY_ANOMALIES = 5;
    static final int MAX_DATE_ANOMALIES = 10;

    private final long seed;

    public SyntheticCorruptor(ReconcileProperties properties) {
        this.seed = properties.getSynthetic().getSeed();
    }

    /**
     * Breaks a fraction of the links so the pair looks like an invoice without a PO.
     */
    public List<LinkedPair> dropLinks(List<LinkedPair> pairs) {
        Random random = new Random(seed);
        List<LinkedPair> result = new ArrayList<>(pairs.size());
        int dropped = 0;
        for (LinkedPair pair : pairs) {
            if (random.nextDouble() < DROPPED_LINK_RATE && pair.isLinked()) {
                result.add(LinkedPair.unmatched(pair.invoice(), pair.candidatePo()));
                dropped++;
            } else {
                result.add(pair);
            }
        }
        log.info("Synthetic corruption dropped {}/{} links", dropped, pairs.size());
        return result;
    }

    /**
     * Removes goods receipts, marks extra POs missing and flips currency consistency
     * on random fractions of the rows.
     */
    public List<FeatureVector> corruptFeatures(List<FeatureVector> rows) {
        Random grnRandom = new Random(seed + 1);
        Random poRandom = new Random(seed + 2);
        Random currencyRandom = new Random(seed + 3);

        List<FeatureVector> result = new ArrayList<>(rows.size());
        for (FeatureVector row : rows) {
            FeatureVector.FeatureVectorBuilder builder = row.toBuilder();
            if (grnRandom.nextDouble() < MISSING_GRN_RATE) {
                builder.hasGrn(false);
            }
            if (poRandom.nextDouble() < EXTRA_MISSING_PO_RATE) {
                builder.poMissing(true).poNumber(null).poTotal(null);
            }
            if (currencyRandom.nextDouble() < CURRENCY_MISMATCH_RATE) {
                builder.currencyMatch(false);
            }
            result.add(builder.build());
        }
        return result;
    }

    /**
     * Applies label-driven noise to already labelled rows.
     */
    public List<LabelledExample> corruptLabels(List<LabelledExample> examples, List<LabelledMismatch> mismatches) {
        List<LabelledExample> result = new ArrayList<>(examples);

        Set<String> missingPo = invoiceIds(mismatches, LabelledMismatch.MISSING_PO);
        apply(result, e -> missingPo.contains(e.features().getInvoiceId()),
                row -> row.toBuilder().poMissing(true).hasGrn(false).build());

        int priceVariances = 0;
        for (LabelledMismatch mismatch : mismatches) {
            if (!LabelledMismatch.PRICE_VARIANCE.equals(mismatch.mismatchType()) || mismatch.difference() == null) {
                continue;
            }
            priceVariances++;
            double difference = mismatch.difference();
            apply(result,
                    e -> Objects.equals(e.features().getInvoiceId(), mismatch.invoiceId())
                            && Objects.equals(e.features().getPoNumber(), mismatch.poNumber()),
                    row -> withDifference(row, difference));
        }

        Random random = new Random(seed + 4);
        List<String> vendorTargets = sample(new ArrayList<>(invoiceIds(mismatches, LabelledMismatch.TAX_MISCODE)),
                MAX_VENDOR_ANOMALIES, random);
        apply(result, e -> vendorTargets.contains(e.features().getInvoiceId()),
                row -> row.toBuilder().vendorMatch(false).vendorSimilarity(0.3 + 0.4 * random.nextDouble()).build());

        List<String> mismatched = new ArrayList<>(new LinkedHashSet<>(result.stream()
                .filter(e -> e.isMismatch() == 1)
                .map(e -> e.features().getInvoiceId())
                .toList()));
        List<String> currencyTargets = sample(mismatched, MAX_CURRENCY_ANOMALIES, random);
        apply(result, e -> currencyTargets.contains(e.features().getInvoiceId()),
                row -> row.toBuilder().currencyMatch(false).build());

        List<String> dateTargets = sample(mismatched, MAX_DATE_ANOMALIES, random);
        apply(result, e -> dateTargets.contains(e.features().getInvoiceId()),
                row -> row.toBuilder().invoiceTooLate(true).build());

        log.info("Applied mismatch patterns: missing PO {}, price variances {}, vendor {}, currency {}, date {}",
                missingPo.size(), priceVariances, vendorTargets.size(), currencyTargets.size(), dateTargets.size());
        return result;
    }

    private static FeatureVector withDifference(FeatureVector row, double difference) {
        Double poTotal = row.getPoTotal();
        double pct = poTotal == null || poTotal == 0.0 ? 0.0 : difference / poTotal;
        FeatureVector.FeatureVectorBuilder builder = row.toBuilder()
                .amountDelta(difference)
                .amountDeltaAbs(Math.abs(difference))
                .amountDeltaPct(Double.isFinite(pct) ? pct : 0.0);
        if (Math.abs(difference) > FeatureEngine.AMOUNT_TOLERANCE) {
            builder.amountOverTolerance(true);
        }
        if (Double.isFinite(pct) && Math.abs(pct) > FeatureEngine.AMOUNT_PCT_TOLERANCE) {
            builder.amountPctOverTolerance(true);
        }
        return builder.build();
    }

    private static void apply(List<LabelledExample> examples,
                              Predicate<LabelledExample> selector,
                              UnaryOperator<FeatureVector> change) {
        for (int i = 0; i < examples.size(); i++) {
            LabelledExample example = examples.get(i);
            if (selector.test(example)) {
                examples.set(i, example.withFeatures(change.apply(example.features())));
            }
        }
    }

    private static Set<String> invoiceIds(List<LabelledMismatch> mismatches, String type) {
        Set<String> ids = new LinkedHashSet<>();
        for (LabelledMismatch mismatch : mismatches) {
            if (type.equals(mismatch.mismatchType())) {
                ids.add(mismatch.invoiceId());
            }
        }
        return ids;
    }

    private static List<String> sample(List<String> candidates, int max, Random random) {
        List<String> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, random);
        return List.copyOf(shuffled.subList(0, Math.min(max, shuffled.size())));
    }
}
