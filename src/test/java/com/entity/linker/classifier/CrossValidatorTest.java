package com.entity.linker.classifier;

import com.entity.linker.core.exception.TrainingException;
import com.entity.linker.core.model.LabeledVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CrossValidator Tests")
class CrossValidatorTest {

    private static final List<LabeledVector> EXAMPLES = TrainingFixtures.separable(25, 17);

    @Nested
    @DisplayName("Fold assignment")
    class FoldAssignment {

        @Test
        @DisplayName("Every fold should keep the class ratio")
        void stratified() {
            int[] folds = CrossValidator.assignFolds(EXAMPLES, 5, 1269);

            for (int fold = 0; fold < 5; fold++) {
                int positives = 0;
                int negatives = 0;
                for (int i = 0; i < folds.length; i++) {
                    if (folds[i] == fold) {
                        if (EXAMPLES.get(i).match()) {
                            positives++;
                        } else {
                            negatives++;
                        }
                    }
                }
                assertEquals(5, positives, "positives in fold " + fold);
                assertEquals(5, negatives, "negatives in fold " + fold);
            }
        }

        @Test
        @DisplayName("The same seed should yield the same folds")
        void stableForSeed() {
            assertArrayEquals(CrossValidator.assignFolds(EXAMPLES, 5, 7), CrossValidator.assignFolds(EXAMPLES, 5, 7));
        }

        @Test
        @DisplayName("Should require at least k examples per class")
        void tooFewExamples() {
            List<LabeledVector> small = TrainingFixtures.separable(3, 1);

            assertThrows(TrainingException.class, () -> CrossValidator.assignFolds(small, 5, 1));
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("Separable data should evaluate perfectly")
        void separable() {
            EvaluationReport report = new CrossValidator().evaluate(ClassifierType.NAIVE_BAYES,
                    ClassifierOptions.defaults(), EXAMPLES, 5, 1269);

            assertEquals("naive_bayes", report.algorithm());
            assertEquals(5, report.foldMetrics().size());
            assertEquals(EXAMPLES.size(), report.foldAssignments().size());
            assertEquals(1.0, report.meanFScore(), 1e-9);
            assertEquals(0.0, report.stdFScore(), 1e-9);
            assertEquals(EXAMPLES.size(), report.pooled().total());
            assertEquals(1.0, report.pooled().precision(), 1e-9);
        }

        @Test
        @DisplayName("Repeated evaluation with a fixed seed should give identical metrics")
        void reproducible() {
            CrossValidator validator = new CrossValidator();
            EvaluationReport first = validator.evaluate(ClassifierType.LINEAR_SVM,
                    ClassifierOptions.defaults(), EXAMPLES, 3, 99);
            EvaluationReport second = validator.evaluate(ClassifierType.LINEAR_SVM,
                    ClassifierOptions.defaults(), EXAMPLES, 3, 99);

            assertEquals(first.foldMetrics(), second.foldMetrics());
            assertEquals(first.foldAssignments(), second.foldAssignments());
        }

        @Test
        @DisplayName("Should reject fewer than two folds")
        void rejectsSingleFold() {
            assertThrows(TrainingException.class, () -> new CrossValidator().evaluate(ClassifierType.NAIVE_BAYES,
                    ClassifierOptions.defaults(), EXAMPLES, 1, 1));
        }

        @Test
        @DisplayName("Should reject a threshold outside [0, 1]")
        void rejectsThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new CrossValidator(1.5));
        }
    }

    @Nested
    @DisplayName("Confusion matrix")
    class Confusion {

        @Test
        @DisplayName("Should derive precision, recall and F-score")
        void metrics() {
            ConfusionMatrix matrix = ConfusionMatrix.empty()
                    .record(true, true)
                    .record(true, true)
                    .record(true, false)
                    .record(false, true)
                    .record(false, false);

            assertEquals(new ConfusionMatrix(2, 1, 1, 1), matrix);
            assertEquals(2.0 / 3.0, matrix.precision(), 1e-9);
            assertEquals(2.0 / 3.0, matrix.recall(), 1e-9);
            assertEquals(2.0 / 3.0, matrix.fScore(), 1e-9);
        }

        @Test
        @DisplayName("Empty denominators should give zero")
        void emptyDenominators() {
            ConfusionMatrix matrix = ConfusionMatrix.empty().record(false, false);

            assertEquals(0.0, matrix.precision());
            assertEquals(0.0, matrix.recall());
            assertEquals(0.0, matrix.fScore());
        }
    }
}
