package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One invoice moving through a reconciliation run.
 * Stages never mutate a task; they derive a new one with the {@code with...} methods.
 */
@Schema(description = "Reconciliation task for a single invoice")
public record ReconciliationTask(
    String invoiceId,
    String poNumber,
    String vendorName,
    MatchResult matchResult,
    boolean needsEmail,
    String emailReason,
    String emailDraft,
    @Schema(description = "Failure message when reconciliation of this task failed")
    String error
) {

    public static ReconciliationTask planned(InvoiceRef ref) {
        return new ReconciliationTask(ref.invoiceId(), ref.poNumber(), ref.vendorName(),
                null, false, null, null, null);
    }

    public ReconciliationTask withMatch(MatchResult result, boolean needsEmail, String emailReason) {
        return new ReconciliationTask(invoiceId, poNumber, vendorName, result, needsEmail, emailReason, null, null);
    }

    public ReconciliationTask withFailure(MatchResult placeholder, String reason, String error) {
        return new ReconciliationTask(invoiceId, poNumber, vendorName, placeholder, false, reason, null, error);
    }

    public ReconciliationTask withEmailDraft(String draft) {
        return new ReconciliationTask(invoiceId, poNumber, vendorName, matchResult, needsEmail, emailReason, draft, error);
    }

    public ReconciliationTask withDraftFailure(String error) {
        return new ReconciliationTask(invoiceId, poNumber, vendorName, matchResult, needsEmail, emailReason, null, error);
    }

    public boolean failed() {
        return error != null;
    }

    public MatchStatus status() {
        return matchResult != null ? matchResult.status() : null;
    }
}
