package com.acme.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Reconciliation API Integration Tests")
class ReconciliationApiIntegrationTest {

    private static final String TRAIN_BODY = """
            {"outputDir": "target/test-model"}
            """;

    private static final String RECONCILE_BODY = """
            {
              "invoices": [
                {"invoiceId": "INV0012", "poNumber": "PO0012", "vendorName": "Acme Supplies Ltd"},
                {"invoiceId": "INV0199", "poNumber": "PO0199", "vendorName": "Global Parts Co"},
                {"invoiceId": "INV0001", "poNumber": "PO0001", "vendorName": "Test Vendor Co"}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void trainModel() throws Exception {
        mockMvc.perform(post("/api/v1/model/train")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRAIN_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.f1_pos").exists())
                .andExpect(jsonPath("$.labelledRows").isNumber());
    }

    @Test
    @DisplayName("Should keep the auto-configured JSON mapper for the API")
    void shouldUseJsonObjectMapper() {
        // Then
        assertThat(objectMapper).isNotInstanceOf(CsvMapper.class);
    }

    @Test
    @DisplayName("Should write the model, metrics and feature table where the service reads them")
    void shouldWriteTrainingOutputs() throws Exception {
        // Then
        Path outputDir = Path.of("target/test-model");
        assertThat(outputDir.resolve("matcher_model.json")).isRegularFile();
        assertThat(outputDir.resolve("features.csv")).isRegularFile();
        JsonNode metrics = objectMapper.readTree(outputDir.resolve("metrics.json").toFile());
        assertThat(metrics.has("f1_pos")).isTrue();
        assertThat(metrics.has("f1Pos")).isFalse();
        assertThat(Files.readString(outputDir.resolve("features.csv"))).startsWith("invoice_id");
    }

    @Test
    @DisplayName("Should score a linked pair with the trained model")
    void shouldScoreLinkedPair() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/reconciliations/score")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"invoiceId\": \"INV0012\", \"poNumber\": \"PO0012\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(true))
                .andExpect(jsonPath("$.confidence").isNumber());
    }

    @Test
    @DisplayName("Should reconcile a batch, persist it and return it by id")
    void shouldReconcileAndRetrieveRun() throws Exception {
        // When
        MvcResult result = mockMvc.perform(post("/api/v1/reconciliations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RECONCILE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("AWAITING_APPROVAL"))
                .andExpect(jsonPath("$.tasks.length()").value(3))
                .andExpect(jsonPath("$.tasks[2].matchResult.status").value("mismatch"))
                .andExpect(jsonPath("$.tasks[2].needsEmail").value(true))
                .andReturn();
        String runId = objectMapper.readTree(result.getResponse().getContentAsString()).get("runId").asText();

        // Then
        mockMvc.perform(get("/api/v1/reconciliations/{runId}", runId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(runId))
                .andExpect(jsonPath("$.status").value("AWAITING_APPROVAL"))
                .andExpect(jsonPath("$.tasks[2].matchResult.status").value("mismatch"));

        mockMvc.perform(get("/api/v1/reconciliations").param("status", "AWAITING_APPROVAL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].runId", hasItem(runId)));
    }

    @Test
    @DisplayName("Should return 404 for an unknown run")
    void shouldReturnNotFoundForUnknownRun() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/v1/reconciliations/{runId}", "no-such-run"))
                .andExpect(status().isNotFound());
    }
}
