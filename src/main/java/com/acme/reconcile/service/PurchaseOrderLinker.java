package com.acme.reconcile.service;

import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.LinkedPair;
import com.acme.reconcile.domain.PurchaseOrderRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links each aggregated invoice to its purchase order.
 * <p>
 * The candidate PO number is derived from the invoice id alone: a leading {@code INV} is
 * replaced with {@code PO} ({@code INV0012 -> PO0012}); any other id is used unchanged.
 * A link requires exact equality on candidate PO number, vendor id and currency. Invoices
 * without a link keep a null purchase order. Linking is a pure function of its inputs.
 */
@Component
@Slf4j
public class PurchaseOrderLinker {

    static final String INVOICE_PREFIX = "INV";
    static final String PO_PREFIX = "PO";

    /**
     * Candidate purchase-order key for an invoice id.
     */
    public static String candidatePo(String invoiceId) {
        if (invoiceId == null) {
            return null;
        }
        if (invoiceId.startsWith(INVOICE_PREFIX)) {
            return PO_PREFIX + invoiceId.substring(INVOICE_PREFIX.length());
        }
        return invoiceId;
    }

    /**
     * Left-joins invoices onto purchase orders. An invoice matching several orders under
     * the same key yields one pair per order.
     */
    public List<LinkedPair> link(List<AggregatedInvoice> invoices, List<PurchaseOrderRecord> purchaseOrders) {
        Map<LinkKey, List<PurchaseOrderRecord>> index = new HashMap<>();
        for (PurchaseOrderRecord po : purchaseOrders) {
            if (po.poNumber() == null) {
                continue;
            }
            index.computeIfAbsent(new LinkKey(po.poNumber(), po.vendorId(), po.currency()), k -> new ArrayList<>())
                    .add(po);
        }

        List<LinkedPair> pairs = new ArrayList<>(invoices.size());
        int linked = 0;
        for (AggregatedInvoice invoice : invoices) {
            String candidate = candidatePo(invoice.invoiceId());
            List<PurchaseOrderRecord> matches =
                    index.getOrDefault(new LinkKey(candidate, invoice.vendorId(), invoice.currency()), List.of());
            if (matches.isEmpty()) {
                pairs.add(LinkedPair.unmatched(invoice, candidate));
                log.debug("No purchase order for invoice {} (candidate {})", invoice.invoiceId(), candidate);
            } else {
                linked++;
                matches.forEach(po -> pairs.add(new LinkedPair(invoice, candidate, po)));
            }
        }

        if (!invoices.isEmpty()) {
            log.info("Linked {}/{} invoices to purchase orders ({} without PO)",
                    linked, invoices.size(), invoices.size() - linked);
        }
        return pairs;
    }

    private record LinkKey(String poNumber, String vendorId, String currency) {}
}
