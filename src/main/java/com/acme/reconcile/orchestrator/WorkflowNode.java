package com.acme.reconcile.orchestrator;

/**
 * One step of the reconciliation workflow.
 */
public interface WorkflowNode {

    /**
     * Consumes the current state and returns the next one. Implementations must not mutate the input.
     */
    WorkflowState apply(WorkflowState state);

    default String name() {
        return getClass().getSimpleName();
    }
}
