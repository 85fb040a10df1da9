package com.acme.reconcile.controller;

import com.acme.reconcile.domain.ReconciliationRequest;
import com.acme.reconcile.domain.ReconciliationResponse;
import com.acme.reconcile.domain.ScoreRequest;
import com.acme.reconcile.domain.ScoreResult;
import com.acme.reconcile.service.ReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for reconciliation runs and single-pair scoring.
 */
@RestController
@RequestMapping("/api/v1/reconciliations")
@Tag(name = "Reconciliation", description = "Invoice / PO reconciliation APIs")
@Slf4j
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    /**
     * Runs a batch of invoices up to the human approval checkpoint.
     */
    @PostMapping
    @Operation(
            summary = "Reconcile invoices",
            description = "Matches each invoice against its PO and goods receipt, drafts vendor emails where needed " +
                         "and stops at the approval checkpoint. Emails are never sent by this call."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Run finished, awaiting approval or completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid request payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Model artifact or dataset missing",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ReconciliationResponse> reconcile(
            @Parameter(description = "Invoices to reconcile", required = true)
            @Valid @RequestBody ReconciliationRequest request) {

        log.info("Received reconciliation request for {} invoices", request.invoices().size());

        return ResponseEntity.ok(reconciliationService.reconcile(request));
    }

    /**
     * Scores a single invoice / PO pair with the trained model.
     */
    @PostMapping("/score")
    @Operation(
            summary = "Score a pair",
            description = "Returns the model's mismatch probability and the canonical facts for one pair, " +
                         "or found=false when the pair has no feature row"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Pair scored or not found",
                    content = @Content(schema = @Schema(implementation = ScoreResult.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Model artifact or dataset missing",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ScoreResult> score(@Valid @RequestBody ScoreRequest request) {
        log.debug("Scoring {} / {}", request.invoiceId(), request.poNumber());
        return ResponseEntity.ok(reconciliationService.score(request));
    }

    /**
     * Lists persisted runs by status, e.g. those waiting for approval.
     */
    @GetMapping
    @Operation(summary = "List runs by status")
    public ResponseEntity<List<ReconciliationResponse>> findRuns(
            @Parameter(description = "Run status", example = "AWAITING_APPROVAL")
            @RequestParam(defaultValue = "AWAITING_APPROVAL") String status) {
        return ResponseEntity.ok(reconciliationService.findRuns(status));
    }

    /**
     * Retrieves a run by its GUID.
     */
    @GetMapping("/{runId}")
    @Operation(
            summary = "Get run by ID",
            description = "Retrieves a previously processed reconciliation run by its GUID"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Run found",
                    content = @Content(schema = @Schema(implementation = ReconciliationResponse.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "Run not found"
            )
    })
    public ResponseEntity<ReconciliationResponse> getRun(
            @Parameter(description = "Run GUID", example = "550e8400-e29b-41d4-a716-446655440000")
            @PathVariable String runId) {

        log.debug("Retrieving reconciliation run: {}", runId);

        return reconciliationService.getRun(runId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/health")
    @Operation(summary = "Health check")
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Reconciliation service is healthy");
    }
}
