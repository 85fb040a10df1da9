package com.acme.reconcile.domain;

import java.util.List;

/**
 * The three record sets a reconciliation run works from.
 */
public record Dataset(
    List<RawInvoiceLine> invoiceLines,
    List<PurchaseOrderRecord> purchaseOrders,
    List<LabelledMismatch> mismatches
) {

    public Dataset {
        invoiceLines = List.copyOf(invoiceLines);
        purchaseOrders = List.copyOf(purchaseOrders);
        mismatches = List.copyOf(mismatches);
    }
}
