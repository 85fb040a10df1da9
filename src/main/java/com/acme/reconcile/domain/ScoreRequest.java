package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Request to score a single invoice / PO pair")
public record ScoreRequest(

    @Schema(description = "Invoice identifier", example = "INV0012")
    @NotBlank(message = "Invoice ID is required")
    String invoiceId,

    @Schema(description = "Purchase order number", example = "PO0012")
    @NotBlank(message = "PO number is required")
    String poNumber
) {}
