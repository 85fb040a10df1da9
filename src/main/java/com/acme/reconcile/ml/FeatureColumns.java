package com.acme.reconcile.ml;

import java.util.List;

/**
 * Column names of the feature vector, as used in model artifacts and the feature table.
 */
public final class FeatureColumns {

    public static final String VENDOR_MATCH = "vendor_match";
    public static final String VENDOR_SIMILARITY = "vendor_similarity";
    public static final String HAS_GRN = "has_grn";
    public static final String AMOUNT_DELTA = "amount_delta";
    public static final String AMOUNT_DELTA_ABS = "amount_delta_abs";
    public static final String AMOUNT_DELTA_PCT = "amount_delta_pct";
    public static final String AMOUNT_OVER_TOLERANCE = "amount_over_tolerance";
    public static final String AMOUNT_PCT_OVER_TOLERANCE = "amount_pct_over_tolerance";
    public static final String DAYS_DELTA = "days_delta";
    public static final String DAYS_SINCE_GRN = "days_since_grn";
    public static final String INVOICE_BEFORE_PO = "invoice_before_po";
    public static final String INVOICE_TOO_LATE = "invoice_too_late";
    public static final String INVOICE_BEFORE_GRN = "invoice_before_grn";
    public static final String PO_MISSING = "po_missing";
    public static final String CURRENCY_MATCH = "currency_match";

    /**
     * Canonical model inputs. Artifacts that do not record their own feature list fall back to this.
     * The signed {@code amount_delta} is not a model input.
     */
    public static final List<String> DEFAULT = List.of(
            VENDOR_MATCH,
            VENDOR_SIMILARITY,
            HAS_GRN,
            AMOUNT_DELTA_ABS,
            AMOUNT_DELTA_PCT,
            AMOUNT_OVER_TOLERANCE,
            AMOUNT_PCT_OVER_TOLERANCE,
            DAYS_DELTA,
            DAYS_SINCE_GRN,
            INVOICE_BEFORE_PO,
            INVOICE_TOO_LATE,
            INVOICE_BEFORE_GRN,
            PO_MISSING,
            CURRENCY_MATCH
    );

    /** Every column written to the labelled feature table, model inputs first. */
    public static final List<String> TABLE = List.of(
            VENDOR_MATCH,
            VENDOR_SIMILARITY,
            HAS_GRN,
            AMOUNT_DELTA,
            AMOUNT_DELTA_ABS,
            AMOUNT_DELTA_PCT,
            AMOUNT_OVER_TOLERANCE,
            AMOUNT_PCT_OVER_TOLERANCE,
            DAYS_DELTA,
            DAYS_SINCE_GRN,
            INVOICE_BEFORE_PO,
            INVOICE_TOO_LATE,
            INVOICE_BEFORE_GRN,
            PO_MISSING,
            CURRENCY_MATCH
    );

    private FeatureColumns() {
    }
}
