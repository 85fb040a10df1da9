package com.acme.reconcile.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * One invoice to reconcile, as submitted in a batch.
 */
@Schema(description = "Invoice / PO pair to reconcile")
public record InvoiceRef(

    @Schema(description = "Invoice identifier", example = "INV0012")
    @NotBlank(message = "Invoice ID is required")
    String invoiceId,

    @Schema(description = "Purchase order number", example = "PO0012")
    @NotBlank(message = "PO number is required")
    String poNumber,

    @Schema(description = "Vendor name used in email drafts", example = "Acme Supplies Ltd")
    @NotBlank(message = "Vendor name is required")
    String vendorName
) {}
