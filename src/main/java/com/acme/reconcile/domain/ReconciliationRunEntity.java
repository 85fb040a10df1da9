package com.acme.reconcile.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Audit record of one reconciliation run.
 * Request and result are stored as JSON documents.
 */
@Entity
@Table(name = "reconciliation_runs")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationRunEntity {

    @Id
    @Column(name = "run_id", length = 36)
    private String runId;

    @Column(name = "status", length = 32, nullable = false)
    private String status;

    @Lob
    @Column(name = "original_request")
    private String originalRequest;

    @Lob
    @Column(name = "result")
    private String result;

    @Column(name = "total_invoices")
    private int totalInvoices;

    @Column(name = "emails_to_send")
    private int emailsToSend;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
