package com.acme.reconcile.domain;

import java.time.LocalDate;

/**
 * One row per invoice, keyed by (invoiceId, vendorId, vendorName, currency).
 *
 * @param invoiceTotal  sum of the line totals (missing totals count as zero)
 * @param lineCount     number of lines carrying a line item number
 * @param maxQty        largest line quantity, null when no line had one
 * @param avgUnitPrice  mean unit price over lines that had one, null otherwise
 * @param invoiceDate   first parseable invoice date of the group, null if none
 */
public record AggregatedInvoice(
    String invoiceId,
    String vendorId,
    String vendorName,
    String currency,
    double invoiceTotal,
    int lineCount,
    Double maxQty,
    Double avgUnitPrice,
    LocalDate invoiceDate
) {}
