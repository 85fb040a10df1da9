package com.acme.reconcile.service;

import com.acme.reconcile.domain.AggregatedInvoice;
import com.acme.reconcile.domain.Dataset;
import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LinkedPair;
import com.acme.reconcile.domain.MatchFacts;
import com.acme.reconcile.domain.ScoreResult;
import com.acme.reconcile.exception.DataNotFoundException;
import com.acme.reconcile.ml.ModelArtifactStore;
import com.acme.reconcile.ml.TrainedModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Scores a single (invoice, purchase order) pair with the trained classifier.
 * <p>
 * The whole aggregate, link and feature pipeline is rebuilt from the dataset on every call
 * and then filtered to the requested pair. That is fine for batch workloads; large datasets
 * would need an indexed lookup instead.
 */
@Service
@Slf4j
public class InvoiceScorer {

    private final DatasetLoader datasetLoader;
    private final InvoiceAggregator aggregator;
    private final PurchaseOrderLinker linker;
    private final FeatureEngine featureEngine;
    private final ModelArtifactStore modelStore;

    public InvoiceScorer(DatasetLoader datasetLoader,
                         InvoiceAggregator aggregator,
                         PurchaseOrderLinker linker,
                         FeatureEngine featureEngine,
                         ModelArtifactStore modelStore) {
        this.datasetLoader = datasetLoader;
        this.aggregator = aggregator;
        this.linker = linker;
        this.featureEngine = featureEngine;
        this.modelStore = modelStore;
    }

    /**
     * Loads model and data, then scores the pair.
     * The model is resolved first so a missing artifact fails before any data is read.
     */
    public ScoreResult score(Path dataDir, Path modelPath, String invoiceId, String poNumber) {
        TrainedModel model = modelStore.load(modelPath);
        Dataset dataset = datasetLoader.load(dataDir);
        return score(dataset, model, invoiceId, poNumber);
    }

    /**
     * Scores the pair against an already loaded dataset and model.
     *
     * @return {@code found=false} when the pipeline yields no row for the pair
     */
    public ScoreResult score(Dataset dataset, TrainedModel model, String invoiceId, String poNumber) {
        List<FeatureVector> rows = buildFeatures(dataset);
        FeatureVector row;
        try {
            row = requireFeatureRow(rows, invoiceId, poNumber);
        } catch (DataNotFoundException e) {
            log.warn(e.getMessage());
            return ScoreResult.notFound(e.getMessage());
        }

        double probability = model.predictProba(row);
        log.debug("Scored {} / {}: mismatch probability {}", invoiceId, poNumber, probability);
        return ScoreResult.found(probability, MatchFacts.of(row));
    }

    List<FeatureVector> buildFeatures(Dataset dataset) {
        List<AggregatedInvoice> invoices = aggregator.aggregate(dataset.invoiceLines());
        List<LinkedPair> pairs = linker.link(invoices, dataset.purchaseOrders());
        return featureEngine.compute(pairs);
    }

    private static FeatureVector requireFeatureRow(List<FeatureVector> rows, String invoiceId, String poNumber) {
        return rows.stream()
                .filter(r -> Objects.equals(r.getInvoiceId(), invoiceId) && Objects.equals(r.getPoNumber(), poNumber))
                .findFirst()
                .orElseThrow(() -> new DataNotFoundException(invoiceId, poNumber));
    }
}
