package com.acme.reconcile.domain;

import com.acme.reconcile.ml.FeatureColumns;
import lombok.Builder;
import lombok.Value;

/**
 * Derived signals for one linked (invoice, purchase order) pair.
 * <p>
 * Every numeric field is finite; flags are plain booleans and become 1.0/0.0
 * when the vector is fed to the classifier. {@code poTotal} and {@code invoiceTotal}
 * are carried as context only and are not model inputs.
 */
@Value
@Builder(toBuilder = true)
public class FeatureVector {

    String invoiceId;
    String poNumber;
    double invoiceTotal;
    Double poTotal;

    double vendorSimilarity;
    boolean vendorMatch;
    boolean hasGrn;
    double amountDelta;
    double amountDeltaAbs;
    double amountDeltaPct;
    boolean amountOverTolerance;
    boolean amountPctOverTolerance;
    double daysDelta;
    double daysSinceGrn;
    boolean invoiceBeforePo;
    boolean invoiceTooLate;
    boolean invoiceBeforeGrn;
    boolean poMissing;
    boolean currencyMatch;

    /**
     * Numeric value of a model column.
     *
     * @param column one of the {@link FeatureColumns} names
     * @throws IllegalArgumentException for an unknown column
     */
    public double value(String column) {
        return switch (column) {
            case FeatureColumns.VENDOR_MATCH -> flag(vendorMatch);
            case FeatureColumns.VENDOR_SIMILARITY -> vendorSimilarity;
            case FeatureColumns.HAS_GRN -> flag(hasGrn);
            case FeatureColumns.AMOUNT_DELTA -> amountDelta;
            case FeatureColumns.AMOUNT_DELTA_ABS -> amountDeltaAbs;
            case FeatureColumns.AMOUNT_DELTA_PCT -> amountDeltaPct;
            case FeatureColumns.AMOUNT_OVER_TOLERANCE -> flag(amountOverTolerance);
            case FeatureColumns.AMOUNT_PCT_OVER_TOLERANCE -> flag(amountPctOverTolerance);
            case FeatureColumns.DAYS_DELTA -> daysDelta;
            case FeatureColumns.DAYS_SINCE_GRN -> daysSinceGrn;
            case FeatureColumns.INVOICE_BEFORE_PO -> flag(invoiceBeforePo);
            case FeatureColumns.INVOICE_TOO_LATE -> flag(invoiceTooLate);
            case FeatureColumns.INVOICE_BEFORE_GRN -> flag(invoiceBeforeGrn);
            case FeatureColumns.PO_MISSING -> flag(poMissing);
            case FeatureColumns.CURRENCY_MATCH -> flag(currencyMatch);
            default -> throw new IllegalArgumentException("Unknown feature column: " + column);
        };
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
