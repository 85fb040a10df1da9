package com.acme.reconcile.orchestrator.nodes;

import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.domain.RunSummary;
import com.acme.reconcile.domain.WorkflowStage;
import com.acme.reconcile.orchestrator.WorkflowNode;
import com.acme.reconcile.orchestrator.WorkflowState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Human approval checkpoint. Summarizes the run and stops; nothing runs after this node.
 * Failed tasks are counted separately and are not included in the status counts.
 */
@Component
public class ApprovalGateNode implements WorkflowNode {

    @Override
    public WorkflowState apply(WorkflowState state) {
        RunSummary summary = summarize(state.tasks());
        WorkflowStage terminal = summary.approvalRequired() ? WorkflowStage.AWAITING_APPROVAL : WorkflowStage.COMPLETED;
        return state.withSummary(summary, terminal);
    }

    static RunSummary summarize(List<ReconciliationTask> tasks) {
        int failed = (int) tasks.stream().filter(ReconciliationTask::failed).count();
        int matches = count(tasks, MatchStatus.MATCH);
        int partial = count(tasks, MatchStatus.PARTIAL);
        int mismatches = count(tasks, MatchStatus.MISMATCH);
        int emails = (int) tasks.stream().filter(ReconciliationTask::needsEmail).count();
        boolean approvalRequired = emails > 0 || mismatches > 0 || failed > 0;
        return new RunSummary(tasks.size(), matches, partial, mismatches, emails, failed, approvalRequired);
    }

    private static int count(List<ReconciliationTask> tasks, MatchStatus status) {
        return (int) tasks.stream()
                .filter(t -> !t.failed() && t.status() == status)
                .count();
    }
}
