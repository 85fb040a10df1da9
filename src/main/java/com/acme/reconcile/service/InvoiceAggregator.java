package com.acme.reconcile.service;

import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.RawInvoiceLine;
import com.acme.reconcile.util.LenientDateParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collapses invoice lines into one {@link AggregatedInvoice} per
 * (invoiceId, vendorId, vendorName, currency), in first-seen order.
 */
@Component
@Slf4j
public class InvoiceAggregator {

    public List<AggregatedInvoice> aggregate(List<RawInvoiceLine> lines) {
        Map<GroupKey, Accumulator> groups = new LinkedHashMap<>();
        for (RawInvoiceLine line : lines) {
            GroupKey key = new GroupKey(line.invoiceId(), line.vendorId(), line.vendorName(), line.currency());
            groups.computeIfAbsent(key, k -> new Accumulator()).add(line);
        }

        List<AggregatedInvoice> invoices = new ArrayList<>(groups.size());
        Set<String> seenIds = new HashSet<>();
        groups.forEach((key, acc) -> {
            if (!seenIds.add(key.invoiceId())) {
                log.warn("Invoice {} appears under more than one vendor/currency key", key.invoiceId());
            }
            invoices.add(acc.toInvoice(key));
        });
        log.debug("Aggregated {} invoice lines into {} invoices", lines.size(), invoices.size());
        return invoices;
    }

    private record GroupKey(String invoiceId, String vendorId, String vendorName, String currency) {}

    private static final class Accumulator {
        private double total;
        private int lineCount;
        private Double maxQty;
        private double unitPriceSum;
        private int unitPriceCount;
        private LocalDate firstDate;

        void add(RawInvoiceLine line) {
            if (line.lineTotal() != null) {
                total += line.lineTotal();
            }
            if (line.lineItemNumber() != null) {
                lineCount++;
            }
            if (line.quantity() != null) {
                maxQty = maxQty == null ? line.quantity() : Math.max(maxQty, line.quantity());
            }
            if (line.unitPrice() != null) {
                unitPriceSum += line.unitPrice();
                unitPriceCount++;
            }
            if (firstDate == null) {
                firstDate = LenientDateParser.parse(line.invoiceDate()).orElse(null);
                if (firstDate == null && line.invoiceDate() != null) {
                    log.warn("Unparseable invoice_date '{}' on invoice {}", line.invoiceDate(), line.invoiceId());
                }
            }
        }

        AggregatedInvoice toInvoice(GroupKey key) {
            Double avgUnitPrice = unitPriceCount == 0 ? null : unitPriceSum / unitPriceCount;
            return new AggregatedInvoice(key.invoiceId(), key.vendorId(), key.vendorName(), key.currency(),
                    total, lineCount, maxQty, avgUnitPrice, firstDate);
        }
    }
}
