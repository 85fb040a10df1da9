package com.acme.reconcile.controller;

import com.acme.reconcile.ReconcileTestData;
import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.MatchResult;
import com.acme.reconcile.domain.MatchStatus;
import com.acme.reconcile.domain.ReconciliationRequest;
import com.acme.reconcile.domain.ReconciliationResponse;
import com.acme.reconcile.domain.ReconciliationTask;
import com.acme.reconcile.domain.RunSummary;
import com.acme.reconcile.domain.ScoreResult;
import com.acme.reconcile.domain.WorkflowStage;
import com.acme.reconcile.exception.ConfigurationException;
import com.acme.reconcile.exception.ToolNotPermittedException;
import com.acme.reconcile.service.ReconciliationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReconciliationController.class)
@DisplayName("ReconciliationController Unit Tests")
class ReconciliationControllerTest {

    private static final String RUN_ID = "550e8400-e29b-41d4-a716-446655440000";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ReconciliationService reconciliationService;

    @Test
    @DisplayName("POST /api/v1/reconciliations - Should return 200 with tasks awaiting approval")
    void shouldReconcileSuccessfully() throws Exception {
        // Given
        ReconciliationRequest request = new ReconciliationRequest(
                List.of(ReconcileTestData.PRICE_VARIANCE_INVOICE), null);
        when(reconciliationService.reconcile(any())).thenReturn(createTestResponse());

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(RUN_ID))
                .andExpect(jsonPath("$.status").value("AWAITING_APPROVAL"))
                .andExpect(jsonPath("$.tasks", hasSize(1)))
                .andExpect(jsonPath("$.tasks[0].matchResult.status").value("mismatch"))
                .andExpect(jsonPath("$.tasks[0].needsEmail").value(true))
                .andExpect(jsonPath("$.summary.approvalRequired").value(true))
                .andExpect(jsonPath("$.errorMessage").doesNotExist());
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations - Should return 400 for an empty batch")
    void shouldReturn400ForEmptyBatch() throws Exception {
        mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"invoices\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"))
                .andExpect(jsonPath("$.errors.invoices").value("At least one invoice is required"));
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations - Should validate invoice fields and confidence range")
    void shouldValidateInvoiceFields() throws Exception {
        // Given - blank vendor name and confidence above 1
        String invalidRequest = """
                {
                    "invoices": [{
                        "invoiceId": "INV0012",
                        "poNumber": "PO0012",
                        "vendorName": ""
                    }],
                    "minConfidence": 1.5
                }
                """;

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(invalidRequest))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Validation failed for one or more fields"))
                .andExpect(jsonPath("$.errors['invoices[0].vendorName']").value("Vendor name is required"))
                .andExpect(jsonPath("$.errors.minConfidence").exists());
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations - Should return 503 when the model is missing")
    void shouldReturn503ForMissingModel() throws Exception {
        // Given
        when(reconciliationService.reconcile(any()))
                .thenThrow(new ConfigurationException("Model not found at ./reports/matcher_model.json"));

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ReconciliationRequest(
                                List.of(ReconcileTestData.CLEAN_INVOICE), 0.75))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.title").value("Configuration Error"))
                .andExpect(jsonPath("$.detail").value("Model not found at ./reports/matcher_model.json"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations - Should return 500 for guardrail rejections")
    void shouldReturn500ForGuardrailRejection() throws Exception {
        // Given
        when(reconciliationService.reconcile(any()))
                .thenThrow(new ToolNotPermittedException("payment_sender", "matcher, email_drafter"));

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ReconciliationRequest(
                                List.of(ReconcileTestData.CLEAN_INVOICE), null))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Tool Invocation Error"));
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations/score - Should return the model score")
    void shouldScorePair() throws Exception {
        // Given
        when(reconciliationService.score(any()))
                .thenReturn(ScoreResult.found(0.2, new MatchFacts(0.0, true, false, true, 13.0)));

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"invoiceId\":\"INV0012\",\"poNumber\":\"PO0012\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.status").value("match"))
                .andExpect(jsonPath("$.confidence").value(0.2))
                .andExpect(jsonPath("$.facts.daysDelta").value(13.0))
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    @DisplayName("POST /api/v1/reconciliations/score - Should report an unknown pair as not found")
    void shouldReportUnknownPair() throws Exception {
        // Given
        when(reconciliationService.score(any()))
                .thenReturn(ScoreResult.notFound("No features found for INV0300 / PO0300"));

        // When/Then
        mockMvc.perform(post("/api/v1/reconciliations/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"invoiceId\":\"INV0300\",\"poNumber\":\"PO0300\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(false))
                .andExpect(jsonPath("$.status").doesNotExist())
                .andExpect(jsonPath("$.message").value("No features found for INV0300 / PO0300"));
    }

    @Test
    @DisplayName("GET /api/v1/reconciliations - Should list runs awaiting approval by default")
    void shouldListRunsAwaitingApproval() throws Exception {
        // Given
        when(reconciliationService.findRuns("AWAITING_APPROVAL")).thenReturn(List.of(createTestResponse()));

        // When/Then
        mockMvc.perform(get("/api/v1/reconciliations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].runId").value(RUN_ID));
    }

    @Test
    @DisplayName("GET /api/v1/reconciliations/{runId} - Should return the run by ID")
    void shouldGetRunById() throws Exception {
        // Given
        when(reconciliationService.getRun(RUN_ID)).thenReturn(Optional.of(createTestResponse()));

        // When/Then
        mockMvc.perform(get("/api/v1/reconciliations/{runId}", RUN_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(RUN_ID))
                .andExpect(jsonPath("$.tasks[0].emailDraft").exists());
    }

    @Test
    @DisplayName("GET /api/v1/reconciliations/{runId} - Should return 404 when not found")
    void shouldReturn404WhenNotFound() throws Exception {
        // Given
        when(reconciliationService.getRun("non-existent-id")).thenReturn(Optional.empty());

        // When/Then
        mockMvc.perform(get("/api/v1/reconciliations/{runId}", "non-existent-id"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /api/v1/reconciliations/health - Should return healthy status")
    void shouldReturnHealthyStatus() throws Exception {
        mockMvc.perform(get("/api/v1/reconciliations/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Reconciliation service is healthy"));
    }

    private ReconciliationResponse createTestResponse() {
        ReconciliationTask task = ReconciliationTask.planned(ReconcileTestData.PRICE_VARIANCE_INVOICE)
                .withMatch(new MatchResult(MatchStatus.MISMATCH, 0.75,
                        new MatchFacts(50.0, true, false, true, 9.0),
                        "Mismatch detected: amount difference of $50.00. Confidence: 0.75"),
                        true, "Material discrepancies detected")
                .withEmailDraft("Subject: URGENT: Invoice Discrepancy - Invoice INV0199 / PO PO0199");
        return ReconciliationResponse.completed(RUN_ID, List.of(task),
                new RunSummary(1, 0, 0, 1, 1, 0, true), WorkflowStage.AWAITING_APPROVAL, OffsetDateTime.now());
    }
}
