package com.acme.reconcile.domain;

/**
 * Historical ground truth: a pair that was confirmed as mismatched.
 */
public record LabelledMismatch(
    String invoiceId,
    String poNumber,
    String mismatchType,
    Double difference
) {

    public static final String MISSING_PO = "MISSING_PO";
    public static final String PRICE_VARIANCE = "PRICE_VARIANCE";
    public static final String TAX_MISCODE = "TAX_MISCODE";
}
