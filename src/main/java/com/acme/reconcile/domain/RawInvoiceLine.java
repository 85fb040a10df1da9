package com.acme.reconcile.domain;

/**
 * One invoice line item as read from the invoice record set.
 * Numeric fields are null when the source value was missing or malformed;
 * the invoice date is kept raw and parsed during aggregation.
 */
public record RawInvoiceLine(
    String invoiceId,
    String vendorId,
    String vendorName,
    String currency,
    String lineItemNumber,
    Double quantity,
    Double unitPrice,
    Double lineTotal,
    String invoiceDate
) {}
