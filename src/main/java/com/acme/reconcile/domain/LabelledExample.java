package com.acme.reconcile.domain;

/**
 * A feature row with its training label attached.
 *
 * @param isMismatch   1 when a historical mismatch record exists for the pair, else 0
 * @param mismatchType recorded mismatch type, null for unlabelled pairs
 * @param difference   recorded amount difference, null when not recorded
 */
public record LabelledExample(
    FeatureVector features,
    int isMismatch,
    String mismatchType,
    Double difference
) {

    public LabelledExample withFeatures(FeatureVector updated) {
        return new LabelledExample(updated, isMismatch, mismatchType, difference);
    }
}
