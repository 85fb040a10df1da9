package com.acme.reconcile.orchestrator.nodes;

import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.exception.ToolExecutionException;
import com.acme.reconcile.orchestrator.ToolCall;
import com.acme.reconcile.orchestrator.ToolGuardrail;
import com.acme.reconcile.orchestrator.WorkflowNode;
import com.acme.reconcile.orchestrator.WorkflowState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drafts a vendor email for every task flagged for one. Drafts are only attached, never sent.
 */
@Component
@Slf4j
public class DraftingNode implements WorkflowNode {

    private final ToolGuardrail guardrail;

    public DraftingNode(ToolGuardrail guardrail) {
        this.guardrail = guardrail;
    }

    @Override
    public WorkflowState apply(WorkflowState state) {
        List<ReconciliationTask> drafted = new ArrayList<>(state.tasks().size());
        int drafts = 0;
        for (ReconciliationTask task : state.tasks()) {
            if (!task.needsEmail() || task.failed()) {
                drafted.add(task);
                continue;
            }
            try {
                String body = guardrail.execute(new ToolCall.EmailDraftCall(task.vendorName(), task.invoiceId(),
                        task.poNumber(), task.matchResult().facts(), task.matchResult().status()));
                drafted.add(task.withEmailDraft(body));
                drafts++;
            } catch (ToolExecutionException e) {
                log.error("Run {}: drafting email for {} failed: {}", state.runId(), task.invoiceId(), e.getMessage());
                drafted.add(task.withDraftFailure(e.getMessage()));
            }
        }
        log.debug("Run {} drafted {} emails", state.runId(), drafts);
        return state.withTasks(drafted, state.stage());
    }
}
