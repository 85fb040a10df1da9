package com.acme.reconcile.orchestrator;

import com.acme.reconcile.domain.InvoiceRef;
import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.domain.RunSummary;
import com.acme.reconcile.domain.WorkflowStage;

import java.util.List;

/**
 * Immutable state handed from one workflow node to the next.
 * Each node returns a new instance; nothing is shared between runs.
 */
public record WorkflowState(
    String runId,
    String dataDir,
    String modelPath,
    double minConfidence,
    List<InvoiceRef> invoices,
    List<ReconciliationTask> tasks,
    RunSummary summary,
    WorkflowStage stage
) {

    public WorkflowState {
        invoices = invoices == null ? List.of() : List.copyOf(invoices);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static WorkflowState start(String runId, String dataDir, String modelPath,
                                      double minConfidence, List<InvoiceRef> invoices) {
        return new WorkflowState(runId, dataDir, modelPath, minConfidence, invoices, List.of(), null,
                WorkflowStage.PLANNING);
    }

    public WorkflowState withTasks(List<ReconciliationTask> newTasks, WorkflowStage next) {
        return new WorkflowState(runId, dataDir, modelPath, minConfidence, invoices, newTasks, summary, next);
    }

    public WorkflowState withSummary(RunSummary newSummary, WorkflowStage next) {
        return new WorkflowState(runId, dataDir, modelPath, minConfidence, invoices, tasks, newSummary, next);
    }
}
