package com.acme.reconcile.service;

import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LinkedPair;
import com.acme.reconcile.domain.PurchaseOrderRecord;
import com.acme.reconcile.ml.FeatureColumns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FeatureEngine Unit Tests")
class FeatureEngineTest {

    private FeatureEngine featureEngine;

    @BeforeEach
    void setUp() {
        featureEngine = new FeatureEngine();
    }

    @Test
    @DisplayName("Should score vendor similarity case-insensitively with token Jaccard")
    void shouldComputeVendorSimilarity() {
        assertThat(FeatureEngine.vendorSimilarity("Acme Supplies Ltd", "acme supplies ltd")).isEqualTo(1.0);
        assertThat(FeatureEngine.vendorSimilarity("Acme Co", "Globex Inc")).isEqualTo(0.0);
        assertThat(FeatureEngine.vendorSimilarity("Test Vendor Co", "Test Vendor Company")).isEqualTo(0.5);
        assertThat(FeatureEngine.vendorSimilarity(null, "Acme")).isEqualTo(0.0);
        assertThat(FeatureEngine.vendorSimilarity("  ", "Acme")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should produce a clean feature row for a matching pair")
    void shouldComputeCleanPair() {
        // Given
        LinkedPair pair = new LinkedPair(
                invoice(1000.0, LocalDate.of(2024, 1, 15), "USD"), "PO0012",
                order(1000.0, LocalDate.of(2024, 1, 2), "GRN0012", LocalDate.of(2024, 1, 10), "USD"));

        // When
        FeatureVector row = featureEngine.compute(pair);

        // Then
        assertThat(row.getPoNumber()).isEqualTo("PO0012");
        assertThat(row.isVendorMatch()).isTrue();
        assertThat(row.isHasGrn()).isTrue();
        assertThat(row.getAmountDelta()).isZero();
        assertThat(row.getDaysDelta()).isEqualTo(13.0);
        assertThat(row.getDaysSinceGrn()).isEqualTo(5.0);
        assertThat(row.isPoMissing()).isFalse();
        assertThat(row.isCurrencyMatch()).isTrue();
        assertThat(row.isInvoiceBeforePo()).isFalse();
        assertThat(row.isInvoiceTooLate()).isFalse();
    }

    @Test
    @DisplayName("Should flag amount differences above absolute and relative tolerance")
    void shouldFlagAmountDifferences() {
        // Given
        LinkedPair pair = new LinkedPair(
                invoice(1200.0, LocalDate.of(2024, 2, 22), "USD"), "PO0103",
                order(1000.0, LocalDate.of(2024, 2, 15), "GRN0103", LocalDate.of(2024, 2, 19), "USD"));

        // When
        FeatureVector row = featureEngine.compute(pair);

        // Then
        assertThat(row.getAmountDelta()).isCloseTo(200.0, within(1e-9));
        assertThat(row.getAmountDeltaAbs()).isCloseTo(200.0, within(1e-9));
        assertThat(row.getAmountDeltaPct()).isCloseTo(0.2, within(1e-9));
        assertThat(row.isAmountOverTolerance()).isTrue();
        assertThat(row.isAmountPctOverTolerance()).isTrue();
    }

    @Test
    @DisplayName("Should clip the relative amount difference to [-1, 1]")
    void shouldClipRelativeDelta() {
        LinkedPair pair = new LinkedPair(
                invoice(5000.0, LocalDate.of(2024, 1, 15), "USD"), "PO0012",
                order(100.0, LocalDate.of(2024, 1, 2), "GRN0012", LocalDate.of(2024, 1, 10), "USD"));

        assertThat(featureEngine.compute(pair).getAmountDeltaPct()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should give zero amount features when the PO total is missing")
    void shouldZeroAmountFeaturesWithoutPoTotal() {
        // Given
        LinkedPair pair = new LinkedPair(
                invoice(750.0, LocalDate.of(2024, 3, 5), "GBP"), "PO0042",
                new PurchaseOrderRecord("PO0042", "V001", "Acme Supplies Ltd", "GBP", null,
                        LocalDate.of(2024, 3, 1), "GRN0042", LocalDate.of(2024, 3, 4)));

        // When
        FeatureVector row = featureEngine.compute(pair);

        // Then
        assertThat(row.getAmountDelta()).isEqualTo(0.0);
        assertThat(row.isAmountOverTolerance()).isFalse();
        assertThat(row.isAmountPctOverTolerance()).isFalse();
        assertThat(row.value(FeatureColumns.AMOUNT_OVER_TOLERANCE)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should mark unlinked invoices as PO missing without raising")
    void shouldHandleUnlinkedInvoice() {
        // Given
        LinkedPair pair = LinkedPair.unmatched(invoice(300.0, null, "USD"), "PO0300");

        // When
        FeatureVector row = featureEngine.compute(pair);

        // Then
        assertThat(row.isPoMissing()).isTrue();
        assertThat(row.isHasGrn()).isFalse();
        assertThat(row.isVendorMatch()).isFalse();
        assertThat(row.getVendorSimilarity()).isZero();
        assertThat(row.getPoNumber()).isNull();
        assertThat(row.getDaysDelta()).isZero();
        assertThat(row.isCurrencyMatch()).isTrue();
    }

    @Test
    @DisplayName("Should apply the timing grace periods")
    void shouldApplyTimingRules() {
        // Given
        LinkedPair early = new LinkedPair(
                invoice(100.0, LocalDate.of(2024, 1, 1), "USD"), "PO0012",
                order(100.0, LocalDate.of(2024, 1, 10), "GRN0012", LocalDate.of(2024, 1, 12), "USD"));
        LinkedPair late = new LinkedPair(
                invoice(100.0, LocalDate.of(2024, 6, 30), "USD"), "PO0012",
                order(100.0, LocalDate.of(2024, 1, 10), "GRN0012", LocalDate.of(2024, 1, 15), "USD"));

        // When
        FeatureVector earlyRow = featureEngine.compute(early);
        FeatureVector lateRow = featureEngine.compute(late);

        // Then
        assertThat(earlyRow.isInvoiceBeforePo()).isTrue();
        assertThat(earlyRow.isInvoiceBeforeGrn()).isTrue();
        assertThat(lateRow.isInvoiceTooLate()).isTrue();
        assertThat(lateRow.getDaysDelta()).isEqualTo(172.0);
    }

    @Test
    @DisplayName("Should reject unknown feature columns")
    void shouldRejectUnknownColumn() {
        FeatureVector row = featureEngine.compute(LinkedPair.unmatched(invoice(1.0, null, "USD"), "PO1"));

        assertThatThrownBy(() -> row.value("bogus"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AggregatedInvoice invoice(double total, LocalDate date, String currency) {
        return new AggregatedInvoice("INV0012", "V001", "Acme Supplies Ltd", currency, total, 1, 1.0, total, date);
    }

    private static PurchaseOrderRecord order(double total, LocalDate poDate, String grn, LocalDate grnDate,
                                             String currency) {
        return new PurchaseOrderRecord("PO0012", "V001", "ACME Supplies Ltd", currency, total, poDate, grn, grnDate);
    }
}
