package com.acme.reconcile.service;

import com.acme.reconcile.config.CsvMapperFactory;
import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.Dataset;
import com.acme.reconcile.domain.LabelledMismatch;
import com.acme.reconcile.domain.PurchaseOrderRecord;
import com.acme.reconcile.domain.RawInvoiceLine;
import com.acme.reconcile.exception.ConfigurationException;
import com.acme.reconcile.util.LenientDateParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads the invoice, purchase-order/GRN and labelled-mismatch record sets from a data directory.
 * <p>
 * A missing record set is fatal. Individual malformed fields are not: numbers that do not parse
 * and dates that cannot be recovered become null and the row is kept.
 */
@Component
@Slf4j
public class DatasetLoader {

    private final CsvMapper csvMapper;
    private final ReconcileProperties properties;

    public DatasetLoader(ReconcileProperties properties) {
        this.csvMapper = CsvMapperFactory.create();
        this.properties = properties;
    }

    /**
     * Loads all three record sets.
     *
     * @param dataDir directory holding the CSV files
     * @throws ConfigurationException if a file is missing or unreadable
     */
    public Dataset load(Path dataDir) {
        verify(dataDir);
        ReconcileProperties.Files files = properties.getFiles();

        List<RawInvoiceLine> invoiceLines = read(dataDir.resolve(files.getInvoices()), this::toInvoiceLine);
        List<PurchaseOrderRecord> purchaseOrders = read(dataDir.resolve(files.getPurchaseOrders()), this::toPurchaseOrder);
        List<LabelledMismatch> mismatches = read(dataDir.resolve(files.getMismatches()), this::toMismatch);

        log.debug("Loaded {} invoice lines, {} purchase orders, {} labelled mismatches from {}",
                invoiceLines.size(), purchaseOrders.size(), mismatches.size(), dataDir);
        return new Dataset(invoiceLines, purchaseOrders, mismatches);
    }

    /**
     * Checks that every record set exists without reading it.
     *
     * @throws ConfigurationException naming the first missing file
     */
    public void verify(Path dataDir) {
        ReconcileProperties.Files files = properties.getFiles();
        for (String name : List.of(files.getInvoices(), files.getPurchaseOrders(), files.getMismatches())) {
            Path file = dataDir.resolve(name);
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("Required dataset file not found: " + file);
            }
        }
    }

    private <T> List<T> read(Path file, Function<Map<String, String>, T> mapper) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerFor(Map.class)
                .with(schema)
                .readValues(file.toFile())) {
            return rows.readAll().stream().map(mapper).toList();
        } catch (IOException e) {
            throw new ConfigurationException("Could not read dataset file " + file, e);
        }
    }

    private RawInvoiceLine toInvoiceLine(Map<String, String> row) {
        return new RawInvoiceLine(
                text(row, "invoice_id"),
                text(row, "vendor_id"),
                text(row, "vendor_name"),
                text(row, "currency"),
                text(row, "line_item_number"),
                number(row, "quantity"),
                number(row, "unit_price"),
                number(row, "line_total"),
                text(row, "invoice_date")
        );
    }

    private PurchaseOrderRecord toPurchaseOrder(Map<String, String> row) {
        return new PurchaseOrderRecord(
                text(row, "po_number"),
                text(row, "vendor_id"),
                text(row, "vendor_name"),
                text(row, "currency"),
                number(row, "po_total"),
                date(row, "po_date"),
                text(row, "grn_number"),
                date(row, "grn_date")
        );
    }

    private LabelledMismatch toMismatch(Map<String, String> row) {
        return new LabelledMismatch(
                text(row, "invoice_id"),
                text(row, "po_number"),
                text(row, "mismatch_type"),
                number(row, "difference")
        );
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Double number(Map<String, String> row, String column) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.replace(",", ""));
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("Unparseable {} value '{}'", column, value);
            return null;
        }
    }

    private static LocalDate date(Map<String, String> row, String column) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        return LenientDateParser.parse(value).orElseGet(() -> {
            log.warn("Unparseable {} value '{}'", column, value);
            return null;
        });
    }
}
