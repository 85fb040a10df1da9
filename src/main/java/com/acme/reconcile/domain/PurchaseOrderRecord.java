package com.acme.reconcile.domain;

import java.time.LocalDate;

/**
 * Combined purchase-order / goods-receipt record.
 * GRN fields are null when no goods receipt was booked.
 */
public record PurchaseOrderRecord(
    String poNumber,
    String vendorId,
    String vendorName,
    String currency,
    Double poTotal,
    LocalDate poDate,
    String grnNumber,
    LocalDate grnDate
) {

    public boolean hasGoodsReceipt() {
        return grnNumber != null && !grnNumber.isBlank();
    }
}
