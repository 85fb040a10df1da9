package com.acme.reconcile.ml;

import com.acme.reconcile.config.ReconcileProperties;
import com.acme.reconcile.domain.LabelledExample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.classification.LogisticRegression;
import smile.validation.metric.Accuracy;
import smile.validation.metric.Precision;
import smile.validation.metric.Recall;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fits the mismatch classifier: an L2-regularized binomial logistic regression.
 * <p>
 * Columns that are constant across the training set are dropped before fitting and the
 * surviving column list is embedded in the artifact. The train/test split is stratified by
 * label and driven by {@code reconcile.training.seed}, so a fixed seed reproduces the model.
 * Positive rows are replicated {@code positive-class-weight} times in the training split to
 * weight mismatches over clean matches.
 */
@Component
@Slf4j
public class MismatchClassifierTrainer {

    private final ReconcileProperties properties;

    public MismatchClassifierTrainer(ReconcileProperties properties) {
        this.properties = properties;
    }

    /**
     * Trains and evaluates a model.
     *
     * @param examples labelled feature rows
     * @return the fitted artifact and its held-out metrics
     * @throws IllegalStateException when every feature is constant or only one class is present
     */
    public TrainingOutcome train(List<LabelledExample> examples) {
        ReconcileProperties.Training settings = properties.getTraining();

        List<String> features = selectFeatures(examples);
        if (features.isEmpty()) {
            throw new IllegalStateException("No valid features found! All features are constant.");
        }
        log.info("Using {} features: {}", features.size(), features);

        double[][] x = toMatrix(examples, features);
        int[] y = examples.stream().mapToInt(LabelledExample::isMismatch).toArray();

        Map<String, Integer> distribution = classDistribution(y);
        log.info("Class distribution: {}", distribution);
        if (distribution.get("0") == 0 || distribution.get("1") == 0) {
            throw new IllegalStateException("Training data must contain both matched and mismatched pairs: "
                    + distribution);
        }

        Split split = stratifiedSplit(y, settings.getTestSize(), settings.getSeed());
        List<Integer> trainRows = weighted(split.train(), y, settings.getPositiveClassWeight());

        double[][] xTrain = rows(x, trainRows);
        int[] yTrain = labels(y, trainRows);

        LogisticRegression.Binomial fitted = LogisticRegression.binomial(
                xTrain, yTrain, settings.getLambda(), settings.getTolerance(), settings.getMaxIterations());

        // Smile keeps the intercept after the feature weights
        double[] w = fitted.coefficients();
        double[] coefficients = new double[features.size()];
        System.arraycopy(w, 0, coefficients, 0, features.size());
        TrainedModel model = new TrainedModel(TrainedModel.CURRENT_SCHEMA_VERSION, features,
                coefficients, w[features.size()], OffsetDateTime.now());

        TrainingMetrics metrics = evaluate(model, examples, y, split, features, distribution, trainRows.size());
        log.info("Trained mismatch classifier: precision={}, recall={}, f1={} on {} held-out rows",
                metrics.precisionPos(), metrics.recallPos(), metrics.f1Pos(), metrics.testSize());
        return new TrainingOutcome(model, metrics);
    }

    /**
     * Canonical columns that take more than one value across the examples.
     */
    List<String> selectFeatures(List<LabelledExample> examples) {
        List<String> selected = new ArrayList<>();
        for (String column : FeatureColumns.DEFAULT) {
            boolean varies = examples.stream()
                    .mapToDouble(e -> e.features().value(column))
                    .distinct()
                    .limit(2)
                    .count() > 1;
            if (varies) {
                selected.add(column);
            } else {
                log.warn("Dropping constant feature '{}'", column);
            }
        }
        return selected;
    }

    /**
     * Per-class shuffled split. Each class with at least two rows keeps one on each side.
     */
    static Split stratifiedSplit(int[] y, double testSize, long seed) {
        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (int label = 0; label <= 1; label++) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < y.length; i++) {
                if (y[i] == label) {
                    members.add(i);
                }
            }
            Collections.shuffle(members, random);
            int nTest = (int) Math.round(members.size() * testSize);
            if (members.size() >= 2) {
                nTest = Math.min(Math.max(nTest, 1), members.size() - 1);
            } else {
                nTest = 0;
            }
            test.addAll(members.subList(0, nTest));
            train.addAll(members.subList(nTest, members.size()));
        }
        Collections.sort(train);
        Collections.sort(test);
        return new Split(train, test);
    }

    private TrainingMetrics evaluate(TrainedModel model,
                                     List<LabelledExample> examples,
                                     int[] y,
                                     Split split,
                                     List<String> features,
                                     Map<String, Integer> distribution,
                                     int trainSize) {
        int[] truth = labels(y, split.test());
        int[] predicted = new int[truth.length];
        for (int i = 0; i < truth.length; i++) {
            double p = model.predictProba(examples.get(split.test().get(i)).features());
            predicted[i] = p >= 0.5 ? 1 : 0;
        }

        ClassMetricsPair perClass = classMetrics(truth, predicted);
        Map<String, TrainingMetrics.ClassMetrics> report = new LinkedHashMap<>();
        report.put("0", perClass.negative());
        report.put("1", perClass.positive());

        Map<String, Double> importance = new LinkedHashMap<>();
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            order.add(i);
        }
        double[] coefficients = model.coefficients();
        order.sort(Comparator.comparingDouble((Integer i) -> Math.abs(coefficients[i])).reversed());
        order.forEach(i -> importance.put(features.get(i), coefficients[i]));

        return new TrainingMetrics(
                perClass.positive().precision(),
                perClass.positive().recall(),
                perClass.positive().f1(),
                truth.length == 0 ? 0.0 : finite(Accuracy.of(truth, predicted)),
                report,
                0.5,
                importance,
                features,
                features.size(),
                distribution,
                trainSize,
                truth.length
        );
    }

    private ClassMetricsPair classMetrics(int[] truth, int[] predicted) {
        int[] invertedTruth = new int[truth.length];
        int[] invertedPredicted = new int[predicted.length];
        int positives = 0;
        for (int i = 0; i < truth.length; i++) {
            invertedTruth[i] = 1 - truth[i];
            invertedPredicted[i] = 1 - predicted[i];
            positives += truth[i];
        }
        return new ClassMetricsPair(
                metricsFor(invertedTruth, invertedPredicted, truth.length - positives),
                metricsFor(truth, predicted, positives));
    }

    private TrainingMetrics.ClassMetrics metricsFor(int[] truth, int[] predicted, int support) {
        if (truth.length == 0) {
            return new TrainingMetrics.ClassMetrics(0.0, 0.0, 0.0, 0);
        }
        double precision = finite(Precision.of(truth, predicted));
        double recall = finite(Recall.of(truth, predicted));
        double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new TrainingMetrics.ClassMetrics(precision, recall, f1, support);
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    private static double[][] toMatrix(List<LabelledExample> examples, List<String> features) {
        double[][] x = new double[examples.size()][features.size()];
        for (int i = 0; i < examples.size(); i++) {
            for (int j = 0; j < features.size(); j++) {
                x[i][j] = examples.get(i).features().value(features.get(j));
            }
        }
        return x;
    }

    private static List<Integer> weighted(List<Integer> rows, int[] y, int positiveWeight) {
        List<Integer> weighted = new ArrayList<>(rows);
        for (Integer row : rows) {
            if (y[row] == 1) {
                for (int copy = 1; copy < positiveWeight; copy++) {
                    weighted.add(row);
                }
            }
        }
        return weighted;
    }

    private static double[][] rows(double[][] x, List<Integer> rows) {
        double[][] subset = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            subset[i] = x[rows.get(i)];
        }
        return subset;
    }

    private static int[] labels(int[] y, List<Integer> rows) {
        return rows.stream().mapToInt(i -> y[i]).toArray();
    }

    private static Map<String, Integer> classDistribution(int[] y) {
        int positives = 0;
        for (int label : y) {
            positives += label;
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("0", y.length - positives);
        distribution.put("1", positives);
        return distribution;
    }

    record Split(List<Integer> train, List<Integer> test) {}

    private record ClassMetricsPair(TrainingMetrics.ClassMetrics negative, TrainingMetrics.ClassMetrics positive) {}
}
