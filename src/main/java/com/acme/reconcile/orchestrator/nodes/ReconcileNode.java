package com.acme.reconcile.orchestrator.nodes;

import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.domain.WorkflowStage;
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
 * Runs the matcher for every task and decides which ones need a vendor email.
 * A failing task is recorded on the task; the rest of the batch carries on.
 */
@Component
@Slf4j
public class ReconcileNode implements WorkflowNode {

    static final String REASON_MISMATCH = "Material discrepancies detected";
    static final String REASON_PARTIAL = "Uncertain match requires clarification";
    static final String REASON_LOW_CONFIDENCE = "Low confidence match requires review";
    static final String REASON_CLEAN = "Clean match - no action required";
    static final String REASON_FAILED = "Reconciliation failed - manual review required";

    private final ToolGuardrail guardrail;

    public ReconcileNode(ToolGuardrail guardrail) {
        this.guardrail = guardrail;
    }

    @Override
    public WorkflowState apply(WorkflowState state) {
        List<ReconciliationTask> reconciled = new ArrayList<>(state.tasks().size());
        for (ReconciliationTask task : state.tasks()) {
            reconciled.add(reconcile(task, state));
        }
        return state.withTasks(reconciled, WorkflowStage.DRAFTING);
    }

    private ReconciliationTask reconcile(ReconciliationTask task, WorkflowState state) {
        MatchResult result;
        try {
            result = guardrail.execute(new ToolCall.MatcherCall(
                    task.invoiceId(), task.poNumber(), state.dataDir(), state.modelPath()));
        } catch (ToolExecutionException e) {
            log.error("Run {}: reconciliation of {} / {} failed: {}",
                    state.runId(), task.invoiceId(), task.poNumber(), e.getMessage());
            MatchResult placeholder = new MatchResult(MatchStatus.PARTIAL, 0.0, MatchFacts.defaults(),
                    "Reconciliation could not be completed: " + e.getMessage());
            return task.withFailure(placeholder, REASON_FAILED, e.getMessage());
        }

        String reason = emailReason(result, state.minConfidence());
        boolean needsEmail = !REASON_CLEAN.equals(reason);
        log.debug("Run {}: {} / {} -> {} ({}), email: {}", state.runId(), task.invoiceId(), task.poNumber(),
                result.status(), result.confidence(), needsEmail);
        return task.withMatch(result, needsEmail, reason);
    }

    static String emailReason(MatchResult result, double minConfidence) {
        if (result.status() == MatchStatus.MISMATCH) {
            return REASON_MISMATCH;
        }
        if (result.status() == MatchStatus.PARTIAL) {
            return REASON_PARTIAL;
        }
        if (result.confidence() < minConfidence) {
            return REASON_LOW_CONFIDENCE;
        }
        return REASON_CLEAN;
    }
}
