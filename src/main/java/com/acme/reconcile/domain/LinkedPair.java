package com.acme.reconcile.domain;

/**
 * An aggregated invoice joined with the purchase order it was linked to.
 * The purchase order is null as a whole when no link was found.
 */
public record LinkedPair(
    AggregatedInvoice invoice,
    String candidatePo,
    PurchaseOrderRecord purchaseOrder
) {

    public static LinkedPair unmatched(AggregatedInvoice invoice, String candidatePo) {
        return new LinkedPair(invoice, candidatePo, null);
    }

    public boolean isLinked() {
        return purchaseOrder != null;
    }

    /** PO number of the linked order, null when unlinked. */
    public String poNumber() {
        return purchaseOrder != null ? purchaseOrder.poNumber() : null;
    }
}
