package com.acme.reconcile.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Client response for a reconciliation run.
 */
@Schema(description = "Result of a reconciliation run")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationResponse(

    @Schema(description = "Unique id of the run", example = "550e8400-e29b-41d4-a716-446655440000")
    String runId,

    @Schema(description = "Per-invoice tasks")
    List<ReconciliationTask> tasks,

    @Schema(description = "Counts over all tasks")
    RunSummary summary,

    @Schema(description = "Terminal stage of the run", example = "AWAITING_APPROVAL")
    WorkflowStage status,

    @Schema(description = "Timestamp when the run finished")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX")
    OffsetDateTime processedAt,

    @Schema(description = "Why the run failed, if it did")
    String errorMessage
) {

    public static ReconciliationResponse completed(String runId, List<ReconciliationTask> tasks, RunSummary summary,
                                                   WorkflowStage status, OffsetDateTime processedAt) {
        return new ReconciliationResponse(runId, tasks, summary, status, processedAt, null);
    }

    public static ReconciliationResponse failed(String runId, OffsetDateTime processedAt, String errorMessage) {
        return new ReconciliationResponse(runId, List.of(), null, WorkflowStage.FAILED, processedAt, errorMessage);
    }
}
