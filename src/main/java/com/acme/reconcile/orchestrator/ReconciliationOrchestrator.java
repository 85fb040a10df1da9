package com.acme.reconcile.orchestrator;

import com.acme.reconcile.domain.InvoiceRef;
import com.acme.reconcile.ml.ModelArtifactStore;
import com.acme.reconcile.orchestrator.nodes.ApprovalGateNode;
import com.acme.reconcile.orchestrator.nodes.DraftingNode;
import com.acme.reconcile.orchestrator.nodes.PlanningNode;
import com.acme.reconcile.orchestrator.nodes.ReconcileNode;
import com.acme.reconcile.service.DatasetLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Drives a batch through planning, reconciling and drafting up to the approval checkpoint.
 * <p>
 * Before any node runs the model artifact and the dataset files are checked, so a missing
 * artifact fails the whole run with a {@link com.acme.reconcile.exception.ConfigurationException}.
 * Past that point failures stay on the task they belong to.
 */
@Component
@Slf4j
public class ReconciliationOrchestrator {

    private final ModelArtifactStore modelStore;
    private final DatasetLoader datasetLoader;
    private final List<WorkflowNode> pipeline;

    public ReconciliationOrchestrator(ModelArtifactStore modelStore,
                                      DatasetLoader datasetLoader,
                                      PlanningNode planningNode,
                                      ReconcileNode reconcileNode,
                                      DraftingNode draftingNode,
                                      ApprovalGateNode approvalGateNode) {
        this.modelStore = modelStore;
        this.datasetLoader = datasetLoader;
        this.pipeline = List.of(planningNode, reconcileNode, draftingNode, approvalGateNode);
    }

    public WorkflowState run(String runId, Path dataDir, Path modelPath,
                             List<InvoiceRef> invoices, double minConfidence) {
        modelStore.load(modelPath);
        datasetLoader.verify(dataDir);

        WorkflowState state = WorkflowState.start(runId, dataDir.toString(), modelPath.toString(),
                minConfidence, invoices);
        for (WorkflowNode node : pipeline) {
            log.debug("Run {}: {} at stage {}", runId, node.name(), state.stage());
            state = node.apply(state);
        }

        if (!state.stage().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " ended in non-terminal stage " + state.stage());
        }
        log.info("Run {} finished in {} ({} tasks, {} emails to send)", runId, state.stage(),
                state.summary().total(), state.summary().emailsToSend());
        return state;
    }
}
