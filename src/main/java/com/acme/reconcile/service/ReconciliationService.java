package com.acme.reconcile.service;

import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.ReconciliationRequest;
import com.acme.reconcile.domain.ReconciliationResponse;
import com.acme.reconcile.domain.ReconciliationRunEntity;
import com.acme.reconcile.domain.ScoreRequest;
import com.acme.reconcile.domain.ScoreResult;
import com.acme.reconcile.domain.WorkflowStage;
import com.acme.reconcile.exception.ConfigurationException;
import com.acme.reconcile.exception.ReconciliationException;
import com.acme.reconcile.orchestrator.ReconciliationOrchestrator;
import com.acme.reconcile.orchestrator.WorkflowState;
import com.acme.reconcile.util.RunIdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for reconciliation runs and single-pair scoring.
 * Responsibilities:
 * - Generate a GUID for each run
 * - Persist the request before the run and the result after it
 * - Resolve data and model locations from configuration
 * - Map workflow state to the client response
 */
@Service
@Slf4j
public class ReconciliationService {

    static final String STATUS_PENDING = "PENDING";
    static final String STATUS_FAILED = WorkflowStage.FAILED.name();

    private final ReconciliationOrchestrator orchestrator;
    private final InvoiceScorer scorer;
    private final ReconciliationRunRepository runRepository;
    private final RunIdGenerator runIdGenerator;
    private final ReconcileProperties properties;
    private final ObjectMapper objectMapper;

    public ReconciliationService(ReconciliationOrchestrator orchestrator,
                                 InvoiceScorer scorer,
                                 ReconciliationRunRepository runRepository,
                                 RunIdGenerator runIdGenerator,
                                 ReconcileProperties properties,
                                 ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.scorer = scorer;
        this.runRepository = runRepository;
        this.runIdGenerator = runIdGenerator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs a batch up to the approval checkpoint.
     * A configuration failure is recorded on the run and then rethrown; the FAILED row is committed.
     *
     * @param request the batch from the client
     * @return the tasks, summary and terminal stage of the run
     */
    @Transactional(noRollbackFor = ConfigurationException.class)
    public ReconciliationResponse reconcile(ReconciliationRequest request) {
        String runId = runIdGenerator.generate();
        double minConfidence = request.minConfidence() != null ? request.minConfidence() : properties.getMinConfidence();
        log.info("Starting reconciliation run {} for {} invoices (min confidence {})",
                runId, request.invoices().size(), minConfidence);

        ReconciliationRunEntity entity = persistRequest(runId, request);
        try {
            WorkflowState state = orchestrator.run(runId, Path.of(properties.getDataDir()),
                    Path.of(properties.getModelPath()), request.invoices(), minConfidence);
            ReconciliationResponse response = ReconciliationResponse.completed(
                    runId, state.tasks(), state.summary(), state.stage(), OffsetDateTime.now());
            persistResult(entity, response);
            return response;
        } catch (ConfigurationException ex) {
            log.error("Reconciliation run {} failed: {}", runId, ex.getMessage());
            entity.setStatus(STATUS_FAILED);
            entity.setErrorMessage(ex.getMessage());
            runRepository.save(entity);
            throw ex;
        }
    }

    /**
     * Retrieves a persisted run by id.
     */
    @Transactional(readOnly = true)
    public Optional<ReconciliationResponse> getRun(String runId) {
        log.debug("Retrieving reconciliation run: {}", runId);
        return runRepository.findById(runId).map(this::toResponse);
    }

    /**
     * Lists persisted runs with the given status, newest first.
     */
    @Transactional(readOnly = true)
    public List<ReconciliationResponse> findRuns(String status) {
        return runRepository.findByStatusOrderByCreatedAtDesc(status).stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Scores one pair against the configured dataset and model.
     */
    public ScoreResult score(ScoreRequest request) {
        return scorer.score(Path.of(properties.getDataDir()), Path.of(properties.getModelPath()),
                request.invoiceId(), request.poNumber());
    }

    private ReconciliationResponse toResponse(ReconciliationRunEntity entity) {
        if (entity.getResult() == null) {
            return ReconciliationResponse.failed(entity.getRunId(), entity.getCreatedAt(), entity.getErrorMessage());
        }
        try {
            return objectMapper.readValue(entity.getResult(), ReconciliationResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Error parsing stored result for {}", entity.getRunId(), e);
            throw new ReconciliationException("Error retrieving reconciliation run " + entity.getRunId(), e);
        }
    }

    private ReconciliationRunEntity persistRequest(String runId, ReconciliationRequest request) {
        ReconciliationRunEntity entity = ReconciliationRunEntity.builder()
                .runId(runId)
                .status(STATUS_PENDING)
                .originalRequest(toJson(request))
                .totalInvoices(request.invoices().size())
                .createdAt(OffsetDateTime.now())
                .build();
        ReconciliationRunEntity saved = runRepository.save(entity);
        log.debug("Persisted run request: {}", runId);
        return saved != null ? saved : entity;
    }

    private void persistResult(ReconciliationRunEntity entity, ReconciliationResponse response) {
        entity.setStatus(response.status().name());
        entity.setResult(toJson(response));
        entity.setEmailsToSend(response.summary().emailsToSend());
        runRepository.save(entity);
        log.debug("Updated run {} with status {}", entity.getRunId(), entity.getStatus());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ReconciliationException("Error serializing reconciliation run", e);
        }
    }
}
