package com.entity.linker.classifier;

import com.entity.linker.core.exception.TrainingException;
import com.entity.linker.core.model.LabeledVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Stratified k-fold cross-validation.
 *
 * <p>Each class is shuffled with the seed and dealt round-robin into the folds, so every
 * fold keeps the class ratio and the same seed always yields the same folds.</p>
 */
public class CrossValidator {
    private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

    public static final int DEFAULT_FOLDS = 5;
    public static final double DEFAULT_THRESHOLD = 0.5;

    private final double threshold;

    public CrossValidator() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold probability from which a calibrated prediction counts as a match
     */
    public CrossValidator(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
    }

    public EvaluationReport evaluate(ClassifierType type, ClassifierOptions options,
                                     List<LabeledVector> examples, int k, long seed) {
        return evaluate(Classifiers.create(type, options), examples, k, seed);
    }

    /**
     * @throws TrainingException if {@code k < 2} or a class has fewer than {@code k} examples
     */
    public EvaluationReport evaluate(Classifier classifier, List<LabeledVector> examples, int k, long seed) {
        if (k < 2) {
            throw new TrainingException("Cross-validation needs at least 2 folds, got " + k);
        }
        int[] assignments = assignFolds(examples, k, seed);

        List<FoldMetrics> foldMetrics = new ArrayList<>(k);
        ConfusionMatrix pooled = ConfusionMatrix.empty();
        for (int fold = 0; fold < k; fold++) {
            List<LabeledVector> train = new ArrayList<>();
            List<LabeledVector> test = new ArrayList<>();
            for (int i = 0; i < examples.size(); i++) {
                (assignments[i] == fold ? test : train).add(examples.get(i));
            }
            Model model = classifier.fit(train);
            SupervisedLinker linker = new SupervisedLinker(model);
            ConfusionMatrix confusion = ConfusionMatrix.empty();
            for (LabeledVector example : test) {
                Prediction prediction = linker.score(example.vector());
                boolean predicted = prediction.calibrated() ? prediction.score() >= threshold : prediction.match();
                confusion = confusion.record(predicted, example.match());
            }
            FoldMetrics metrics = new FoldMetrics(fold, confusion);
            foldMetrics.add(metrics);
            pooled = pooled.plus(confusion);
            log.debug("evaluation.fold algorithm={} fold={} precision={} recall={} f={}",
                    classifier.type().id(), fold, metrics.precision(), metrics.recall(), metrics.fScore());
        }

        EvaluationReport report = new EvaluationReport(
                classifier.type().id(), k, seed, foldMetrics,
                Arrays.stream(assignments).boxed().toList(), pooled);
        log.info("evaluation.completed algorithm={} folds={} precision={} recall={} f={}",
                report.algorithm(), k, report.meanPrecision(), report.meanRecall(), report.meanFScore());
        return report;
    }

    /**
     * Assigns every example to a fold.
     *
     * @return fold index per example, in input order
     */
    public static int[] assignFolds(List<LabeledVector> examples, int k, long seed) {
        List<Integer> positives = new ArrayList<>();
        List<Integer> negatives = new ArrayList<>();
        for (int i = 0; i < examples.size(); i++) {
            (examples.get(i).match() ? positives : negatives).add(i);
        }
        if (positives.size() < k || negatives.size() < k) {
            throw new TrainingException("Each class needs at least " + k + " examples for " + k
                    + "-fold cross-validation, got " + positives.size() + " matches and "
                    + negatives.size() + " non-matches");
        }
        Random random = new Random(seed);
        Collections.shuffle(positives, random);
        Collections.shuffle(negatives, random);

        int[] assignments = new int[examples.size()];
        for (int i = 0; i < positives.size(); i++) {
            assignments[positives.get(i)] = i % k;
        }
        for (int i = 0; i < negatives.size(); i++) {
            assignments[negatives.get(i)] = i % k;
        }
        return assignments;
    }
}
