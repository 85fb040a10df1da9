package com.acme.reconcile.domain;

/**
 * Stages of a reconciliation run. AWAITING_APPROVAL and COMPLETED are where a run ends normally.
 * FAILED is only recorded on runs aborted before the workflow started.
 */
public enum WorkflowStage {
    PLANNING,
    RECONCILING,
    DRAFTING,
    AWAITING_APPROVAL,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == AWAITING_APPROVAL || this == COMPLETED;
    }
}
