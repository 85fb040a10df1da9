package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Client request for a batch reconciliation run.
 */
@Schema(description = "Request to reconcile a batch of invoices")
public record ReconciliationRequest(

    @Schema(description = "Invoices to reconcile")
    @NotEmpty(message = "At least one invoice is required")
    @Valid
    List<InvoiceRef> invoices,

    @Schema(description = "Minimum confidence below which a match still needs an email", example = "0.75")
    @DecimalMin(value = "0.0", message = "Minimum confidence must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Minimum confidence must be between 0 and 1")
    Double minConfidence
) {}
