package com.acme.reconcile.service;

import com.acme.reconcile.domain.FeatureVector;
import com.acme.reconcile.domain.LabelledExample;
import com.acme.reconcile.domain.LabelledMismatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins historical mismatch records onto feature rows by (invoiceId, poNumber).
 * <p>
 * A row with no historical record is labelled {@code is_mismatch = 0}: absence of contrary
 * evidence is read as a match. When several records share a pair, the first one wins.
 * Feature values are never altered here.
 */
@Component
@Slf4j
public class LabelAttacher {

    public List<LabelledExample> attach(List<FeatureVector> rows, List<LabelledMismatch> mismatches) {
        Map<PairKey, LabelledMismatch> labels = new LinkedHashMap<>();
        for (LabelledMismatch mismatch : mismatches) {
            labels.putIfAbsent(new PairKey(mismatch.invoiceId(), mismatch.poNumber()), mismatch);
        }

        List<LabelledExample> examples = rows.stream()
                .map(row -> {
                    LabelledMismatch label = labels.get(new PairKey(row.getInvoiceId(), row.getPoNumber()));
                    return label == null
                            ? new LabelledExample(row, 0, null, null)
                            : new LabelledExample(row, 1, label.mismatchType(), label.difference());
                })
                .toList();

        long positives = examples.stream().filter(e -> e.isMismatch() == 1).count();
        log.info("Attached labels: {} mismatches, {} assumed matches", positives, examples.size() - positives);
        return examples;
    }

    private record PairKey(String invoiceId, String poNumber) {}
}
