package com.acme.reconcile.service;

import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LinkedPair;
import com.acme.reconcile.domain.PurchaseOrderRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the feature vector of a linked pair.
 * <p>
 * Total over its inputs: missing purchase-order data, missing dates and degenerate totals
 * all produce well-defined values, and any non-finite intermediate becomes 0.0.
 */
@Component
public class FeatureEngine {

    static final double VENDOR_MATCH_THRESHOLD = 0.8;
    static final double AMOUNT_TOLERANCE = 100.0;
    static final double AMOUNT_PCT_TOLERANCE = 0.05;
    static final long INVOICE_BEFORE_PO_GRACE_DAYS = -2;
    static final long INVOICE_TOO_LATE_DAYS = 120;
    static final long INVOICE_BEFORE_GRN_GRACE_DAYS = -3;

    public List<FeatureVector> compute(List<LinkedPair> pairs) {
        return pairs.stream().map(this::compute).toList();
    }

    public FeatureVector compute(LinkedPair pair) {
        AggregatedInvoice invoice = pair.invoice();
        PurchaseOrderRecord po = pair.purchaseOrder();

        double similarity = finite(vendorSimilarity(invoice.vendorName(), po != null ? po.vendorName() : null));

        Double poTotal = po != null ? po.poTotal() : null;
        double amountDelta = poTotal == null ? 0.0 : finite(invoice.invoiceTotal() - poTotal);
        double amountDeltaAbs = Math.abs(amountDelta);
        double amountDeltaPct = poTotal == null || poTotal == 0.0
                ? 0.0
                : clip(finite(amountDelta / poTotal), -1.0, 1.0);

        Long daysDelta = daysBetween(po != null ? po.poDate() : null, invoice.invoiceDate());
        Long daysSinceGrn = daysBetween(po != null ? po.grnDate() : null, invoice.invoiceDate());

        return FeatureVector.builder()
                .invoiceId(invoice.invoiceId())
                .poNumber(pair.poNumber())
                .invoiceTotal(finite(invoice.invoiceTotal()))
                .poTotal(poTotal)
                .vendorSimilarity(similarity)
                .vendorMatch(similarity > VENDOR_MATCH_THRESHOLD)
                .hasGrn(po != null && po.hasGoodsReceipt())
                .amountDelta(amountDelta)
                .amountDeltaAbs(amountDeltaAbs)
                .amountDeltaPct(amountDeltaPct)
                .amountOverTolerance(amountDeltaAbs > AMOUNT_TOLERANCE)
                .amountPctOverTolerance(Math.abs(amountDeltaPct) > AMOUNT_PCT_TOLERANCE)
                .daysDelta(daysDelta == null ? 0.0 : daysDelta)
                .daysSinceGrn(daysSinceGrn == null ? 0.0 : daysSinceGrn)
                .invoiceBeforePo(daysDelta != null && daysDelta < INVOICE_BEFORE_PO_GRACE_DAYS)
                .invoiceTooLate(daysDelta != null && daysDelta > INVOICE_TOO_LATE_DAYS)
                .invoiceBeforeGrn(daysSinceGrn != null && daysSinceGrn < INVOICE_BEFORE_GRN_GRACE_DAYS)
                .poMissing(!pair.isLinked())
                .currencyMatch(po == null || Objects.equals(invoice.currency(), po.currency()))
                .build();
    }

    /**
     * Token-set Jaccard similarity of two vendor names, case- and whitespace-insensitive.
     * Returns 0 when either name is missing.
     */
    public static double vendorSimilarity(String first, String second) {
        if (first == null || second == null || first.isBlank() || second.isBlank()) {
            return 0.0;
        }
        String a = first.toLowerCase(Locale.ROOT).trim();
        String b = second.toLowerCase(Locale.ROOT).trim();
        if (a.equals(b)) {
            return 1.0;
        }
        Set<String> tokensA = tokens(a);
        Set<String> tokensB = tokens(b);
        Set<String> union = new HashSet<>(tokensA);
        union.addAll(tokensB);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(tokensA);
        common.retainAll(tokensB);
        return (double) common.size() / union.size();
    }

    private static Set<String> tokens(String name) {
        return new HashSet<>(Arrays.asList(name.split("\\s+")));
    }

    private static Long daysBetween(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(from, to);
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
