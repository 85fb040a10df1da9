package com.acme.reconcile.orchestrator.nodes;

import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.domain.WorkflowStage;
import com.acme.reconcile.orchestrator.WorkflowNode;
import com.acme.reconcile.orchestrator.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Expands the submitted batch into one task per invoice.
 */
@Component
@Slf4j
public class PlanningNode implements WorkflowNode {

    @Override
    public WorkflowState apply(WorkflowState state) {
        List<ReconciliationTask> tasks = state.invoices().stream()
                .map(ReconciliationTask::planned)
                .toList();
        log.debug("Run {} planned {} tasks", state.runId(), tasks.size());
        return state.withTasks(tasks, WorkflowStage.RECONCILING);
    }
}
