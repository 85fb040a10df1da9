package com.acme.reconcile.exception;

/**
 * Thrown when no feature row exists for a requested (invoice, purchase order) pair.
 * Recoverable: callers surface it as a {@code found=false} score.
 */
public class DataNotFoundException extends ReconciliationException {

    private final String invoiceId;
    private final String poNumber;

    public DataNotFoundException(String invoiceId, String poNumber) {
        super("No feature row for invoice " + invoiceId + " / PO " + poNumber);
        this.invoiceId = invoiceId;
        this.poNumber = poNumber;
    }

    public String getInvoiceId() {
        return invoiceId;
    }

    public String getPoNumber() {
        return poNumber;
    }
}
