package com.acme.reconcile.service;

import com.acme.reconcile.config.CsvMapperFactory;
import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.Dataset;
import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LabelledExample;
import com.acme.reconcile.domain.LinkedPair;
import com.acme.reconcile.domain.TrainingReport;
import com.acme.reconcile.domain.TrainingRequest;
import com.acme.reconcile.exception.ConfigurationException;
import com.acme.reconcile.ml.FeatureColumns;
import com.acme.reconcile.ml.MismatchClassifierTrainer;
import com.acme.reconcile.ml.ModelArtifactStore;
import com.acme.reconcile.ml.TrainingOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Training entry point: builds the labelled feature table, fits the classifier and writes
 * {@code features.csv}, {@code metrics.json} and {@code matcher_model.json} to the output directory.
 * <p>
 * Synthetic corruption is applied only when the request asks for it (or it is enabled in configuration).
 */
@Service
@Slf4j
public class TrainingService {

    static final String FEATURES_FILE = "features.csv";
    static final String METRICS_FILE = "metrics.json";
    static final String MODEL_FILE = "matcher_model.json";

    private static final List<String> ID_COLUMNS = List.of("invoice_id", "po_number", "invoice_total", "po_total");
    private static final List<String> LABEL_COLUMNS = List.of("is_mismatch", "mismatch_type", "difference");

    private final DatasetLoader datasetLoader;
    private final InvoiceAggregator aggregator;
    private final PurchaseOrderLinker linker;
    private final FeatureEngine featureEngine;
    private final LabelAttacher labelAttacher;
    private final SyntheticCorruptor corruptor;
    private final MismatchClassifierTrainer trainer;
    private final ModelArtifactStore modelStore;
    private final ReconcileProperties properties;
    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public TrainingService(DatasetLoader datasetLoader,
                           InvoiceAggregator aggregator,
                           PurchaseOrderLinker linker,
                           FeatureEngine featureEngine,
                           LabelAttacher labelAttacher,
                           SyntheticCorruptor corruptor,
                           MismatchClassifierTrainer trainer,
                           ModelArtifactStore modelStore,
                           ReconcileProperties properties,
                           ObjectMapper objectMapper) {
        this.datasetLoader = datasetLoader;
        this.aggregator = aggregator;
        this.linker = linker;
        this.featureEngine = featureEngine;
        this.labelAttacher = labelAttacher;
        this.corruptor = corruptor;
        this.trainer = trainer;
        this.modelStore = modelStore;
        this.properties = properties;
        this.csvMapper = CsvMapperFactory.create();
        this.objectMapper = objectMapper;
    }

    public TrainingReport train(TrainingRequest request) {
        Path dataDir = Path.of(request.dataDir() != null ? request.dataDir() : properties.getDataDir());
        Path outputDir = Path.of(request.outputDir() != null ? request.outputDir() : properties.getOutputDir());
        boolean synthetic = request.syntheticCorruption() != null
                ? request.syntheticCorruption()
                : properties.getSynthetic().isEnabled();
        log.info("Training matcher model from {} into {} (synthetic corruption: {})", dataDir, outputDir, synthetic);

        List<LabelledExample> labelled = buildLabelledTable(datasetLoader.load(dataDir), synthetic);
        TrainingOutcome outcome = trainer.train(labelled);

        Path featuresPath = outputDir.resolve(FEATURES_FILE);
        Path metricsPath = outputDir.resolve(METRICS_FILE);
        Path modelPath = outputDir.resolve(MODEL_FILE);
        writeFeatureTable(labelled, featuresPath);
        writeMetrics(outcome, metricsPath);
        modelStore.save(outcome.model(), modelPath);

        log.info("Training finished: {} rows, features {}, F1(mismatch) {}", labelled.size(),
                outcome.model().featureList(), outcome.metrics().f1Pos());
        return new TrainingReport(outcome.metrics(), modelPath.toString(), metricsPath.toString(),
                featuresPath.toString(), labelled.size(), synthetic);
    }

    List<LabelledExample> buildLabelledTable(Dataset dataset, boolean synthetic) {
        List<AggregatedInvoice> invoices = aggregator.aggregate(dataset.invoiceLines());
        List<LinkedPair> pairs = linker.link(invoices, dataset.purchaseOrders());
        if (synthetic) {
            pairs = corruptor.dropLinks(pairs);
        }

        List<FeatureVector> rows = featureEngine.compute(pairs);
        if (synthetic) {
            rows = corruptor.corruptFeatures(rows);
        }

        List<LabelledExample> labelled = labelAttacher.attach(rows, dataset.mismatches());
        if (synthetic) {
            labelled = corruptor.corruptLabels(labelled, dataset.mismatches());
        }
        return labelled;
    }

    private void writeFeatureTable(List<LabelledExample> labelled, Path path) {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        ID_COLUMNS.forEach(schema::addColumn);
        FeatureColumns.TABLE.forEach(schema::addColumn);
        LABEL_COLUMNS.forEach(schema::addColumn);

        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            try (SequenceWriter writer = csvMapper.writer(schema.build()).writeValues(path.toFile())) {
                for (LabelledExample example : labelled) {
                    writer.write(toRow(example));
                }
            }
            log.debug("Wrote {} feature rows to {}", labelled.size(), path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not write feature table to " + path, e);
        }
    }

    private static Map<String, Object> toRow(LabelledExample example) {
        FeatureVector features = example.features();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("invoice_id", features.getInvoiceId());
        row.put("po_number", features.getPoNumber());
        row.put("invoice_total", features.getInvoiceTotal());
        row.put("po_total", features.getPoTotal());
        for (String column : FeatureColumns.TABLE) {
            row.put(column, features.value(column));
        }
        row.put("is_mismatch", example.isMismatch());
        row.put("mismatch_type", example.mismatchType());
        row.put("difference", example.difference());
        return row;
    }

    private void writeMetrics(TrainingOutcome outcome, Path path) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), outcome.metrics());
        } catch (IOException e) {
            throw new ConfigurationException("Could not write metrics to " + path, e);
        }
    }
}
