package com.entity.linker.classifier;

import com.entity.linker.core.exception.TrainingException;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.FeatureSchema;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.LabeledVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Classifier Tests")
class ClassifierTest {

    private static final List<LabeledVector> TRAINING = TrainingFixtures.separable(20, 42);

    private static final ClassifierOptions FAST = ClassifierOptions.builder()
            .learningRate(0.05)
            .hiddenLayers(List.of(16, 8))
            .build();

    @Nested
    @DisplayName("Training on separable data")
    class Separable {

        @ParameterizedTest
        @EnumSource(ClassifierType.class)
        @DisplayName("Every algorithm should separate clear matches from clear non-matches")
        void separates(ClassifierType type) {
            Model model = Classifiers.create(type, FAST).fit(TRAINING);
            SupervisedLinker linker = new SupervisedLinker(model);

            Prediction match = linker.score(TrainingFixtures.vector("Qx", "Tx", 1.0, 1.0, 1.0));
            Prediction nonMatch = linker.score(TrainingFixtures.vector("Qx", "Ty", 0.0, 0.0, 0.0));

            assertTrue(match.match(), type + " should accept a perfect vector");
            assertFalse(nonMatch.match(), type + " should reject an empty vector");
            assertTrue(match.score() > nonMatch.score());
            assertEquals(type.isCalibrated(), match.calibrated());
        }

        @ParameterizedTest
        @EnumSource(ClassifierType.class)
        @DisplayName("Calibrated algorithms should emit probabilities")
        void calibratedRange(ClassifierType type) {
            Model model = Classifiers.create(type, FAST).fit(TRAINING);
            SupervisedLinker linker = new SupervisedLinker(model);

            for (LabeledVector example : TRAINING) {
                Prediction prediction = linker.score(example.vector());
                if (type.isCalibrated()) {
                    assertTrue(prediction.score() >= 0.0 && prediction.score() <= 1.0);
                }
            }
        }

        @ParameterizedTest
        @EnumSource(ClassifierType.class)
        @DisplayName("Training should be deterministic for a given seed")
        void deterministic(ClassifierType type) {
            FeatureVector sample = TrainingFixtures.vector("Qp", "Tp", 0.5, 0.4, 0.6);

            double first = new SupervisedLinker(Classifiers.create(type, FAST).fit(TRAINING)).score(sample).score();
            double second = new SupervisedLinker(Classifiers.create(type, FAST).fit(TRAINING)).score(sample).score();

            assertEquals(first, second);
        }

        @Test
        @DisplayName("Naive Bayes should ignore values at or below the binarize threshold")
        void naiveBayesBinarizes() {
            SupervisedLinker linker = new SupervisedLinker(
                    new NaiveBayesClassifier(ClassifierOptions.defaults()).fit(TRAINING));

            double atThreshold = linker.score(TrainingFixtures.vector("Qa", "Ta", 0.1, 0.1, 0.1)).score();
            double zero = linker.score(TrainingFixtures.vector("Qb", "Tb", 0.0, 0.0, 0.0)).score();

            assertEquals(zero, atThreshold, 1e-12);
        }

        @Test
        @DisplayName("Multi-layer perceptron should use the configured hidden layers")
        void hiddenLayers() {
            NeuralNetworkClassifier classifier = NeuralNetworkClassifier.multiLayer(FAST);
            Model model = classifier.fit(TRAINING);

            assertEquals(List.of(16, 8), classifier.getHiddenLayers());
            NeuralNetworkParameters parameters = (NeuralNetworkParameters) model.getParameters();
            assertEquals(3, parameters.layers().size());
            assertEquals(1, parameters.layers().get(2).outputSize());
            assertTrue(NeuralNetworkClassifier.singleLayer(FAST).getHiddenLayers().isEmpty());
        }
    }

    @Nested
    @DisplayName("Trained parameters")
    class TrainedParameters {

        private final FeatureVector input = TrainingFixtures.vector("Qm", "Tm", 0.9, 0.95, 0.88);

        @Test
        @DisplayName("Writing into naive Bayes tables should not change scores")
        void naiveBayesTables() {
            Model model = Classifiers.create(ClassifierType.NAIVE_BAYES, FAST).fit(TRAINING);
            SupervisedLinker linker = new SupervisedLinker(model);
            double before = linker.score(input).score();

            NaiveBayesParameters parameters = (NaiveBayesParameters) model.getParameters();
            parameters.logPresentGivenMatch()[0] = -1_000.0;
            parameters.logAbsentGivenNonMatch()[1] = 1_000.0;

            assertEquals(before, linker.score(input).score());
        }

        @Test
        @DisplayName("Writing into linear weights should not change margins")
        void linearWeights() {
            Model model = Classifiers.create(ClassifierType.LINEAR_SVM, FAST).fit(TRAINING);
            SupervisedLinker linker = new SupervisedLinker(model);
            double before = linker.score(input).score();

            ((LinearParameters) model.getParameters()).weights()[0] = -1_000.0;

            assertEquals(before, linker.score(input).score());
        }

        @Test
        @DisplayName("Writing into kernel and network matrices should not change scores")
        void matrices() {
            Model svm = Classifiers.create(ClassifierType.SVM, FAST).fit(TRAINING);
            Model network = Classifiers.create(ClassifierType.MULTI_LAYER_PERCEPTRON, FAST).fit(TRAINING);
            double svmBefore = new SupervisedLinker(svm).score(input).score();
            double networkBefore = new SupervisedLinker(network).score(input).score();

            KernelSvmParameters kernel = (KernelSvmParameters) svm.getParameters();
            kernel.supportVectors()[0][0] = 1_000.0;
            kernel.coefficients()[0] = 1_000.0;
            NeuralNetworkParameters.DenseLayer output =
                    ((NeuralNetworkParameters) network.getParameters()).layers().get(2);
            output.weights()[0][0] = -1_000.0;
            output.biases()[0] = -1_000.0;

            assertEquals(svmBefore, new SupervisedLinker(svm).score(input).score());
            assertEquals(networkBefore, new SupervisedLinker(network).score(input).score());
        }

        @Test
        @DisplayName("Parameters should not share arrays handed to their constructor")
        void constructorCopies() {
            double[] weights = {1.0, 1.0, 1.0};
            LinearParameters parameters = new LinearParameters(weights, -1.5);
            double before = parameters.score(new double[]{1.0, 1.0, 0.0});

            weights[0] = -1_000.0;

            assertEquals(before, parameters.score(new double[]{1.0, 1.0, 0.0}));
        }
    }

    @Nested
    @DisplayName("Random forest")
    class RandomForest {

        @Test
        @DisplayName("Should grow the configured number of depth-bounded trees")
        void forestShape() {
            ClassifierOptions options = ClassifierOptions.builder().forestSize(7).maxTreeDepth(2).build();
            Model model = Classifiers.create(ClassifierType.RANDOM_FOREST, options).fit(TRAINING);

            RandomForestParameters parameters = (RandomForestParameters) model.getParameters();
            assertEquals(7, parameters.trees().size());
            assertEquals(3, parameters.inputSize());
            for (RandomForestParameters.DecisionTree tree : parameters.trees()) {
                assertTrue(tree.size() <= 7, "a depth-2 tree has at most 7 nodes");
            }
            assertEquals("7", model.getMetadata().hyperparameters().get("trees"));
        }

        @Test
        @DisplayName("Score should be the fraction of trees voting match")
        void voteFraction() {
            ClassifierOptions options = ClassifierOptions.builder().forestSize(25).build();
            SupervisedLinker linker = new SupervisedLinker(
                    Classifiers.create(ClassifierType.RANDOM_FOREST, options).fit(TRAINING));

            assertEquals(1.0, linker.score(TrainingFixtures.vector("Qx", "Tx", 1.0, 1.0, 1.0)).score(), 1e-12);
            assertEquals(0.0, linker.score(TrainingFixtures.vector("Qx", "Ty", 0.0, 0.0, 0.0)).score(), 1e-12);
        }

        @Test
        @DisplayName("Entropy should be measured in bits")
        void entropy() {
            assertEquals(1.0, RandomForestClassifier.entropy(5, 10), 1e-12);
            assertEquals(0.0, RandomForestClassifier.entropy(0, 10));
            assertEquals(0.0, RandomForestClassifier.entropy(10, 10));
        }

        @Test
        @DisplayName("Should reject trees whose children point backwards")
        void invalidTree() {
            assertThrows(IllegalArgumentException.class, () -> new RandomForestParameters.DecisionTree(
                    new int[]{0, -1}, new double[]{0.5, 0.0}, new int[]{0, 0}, new int[]{1, 0},
                    new double[]{0.5, 1.0}));
        }
    }

    @Nested
    @DisplayName("Voting classifier")
    class Voting {

        @Test
        @DisplayName("Soft voting should average the members' probabilities")
        void softAverage() {
            ClassifierOptions options = ClassifierOptions.builder()
                    .forestSize(15)
                    .votingMembers(List.of(ClassifierType.NAIVE_BAYES, ClassifierType.RANDOM_FOREST))
                    .build();
            FeatureVector input = TrainingFixtures.vector("Qv", "Tv", 0.5, 0.4, 0.6);

            double naiveBayes = new SupervisedLinker(Classifiers.create(ClassifierType.NAIVE_BAYES, options)
                    .fit(TRAINING)).score(input).score();
            double forest = new SupervisedLinker(Classifiers.create(ClassifierType.RANDOM_FOREST, options)
                    .fit(TRAINING)).score(input).score();
            Model voting = Classifiers.create(ClassifierType.VOTING, options).fit(TRAINING);

            assertEquals((naiveBayes + forest) / 2.0, new SupervisedLinker(voting).score(input).score(), 1e-12);
            assertEquals(2, ((VotingParameters) voting.getParameters()).members().size());
        }

        @Test
        @DisplayName("Hard voting should accept margin members and score the vote fraction")
        void hardVote() {
            ClassifierOptions options = ClassifierOptions.builder()
                    .votingMode(VotingMode.HARD)
                    .votingMembers(List.of(ClassifierType.NAIVE_BAYES, ClassifierType.LINEAR_SVM))
                    .build();
            SupervisedLinker linker = new SupervisedLinker(
                    Classifiers.create(ClassifierType.VOTING, options).fit(TRAINING));

            Prediction match = linker.score(TrainingFixtures.vector("Qx", "Tx", 1.0, 1.0, 1.0));
            Prediction nonMatch = linker.score(TrainingFixtures.vector("Qx", "Ty", 0.0, 0.0, 0.0));

            assertEquals(1.0, match.score());
            assertEquals(0.0, nonMatch.score());
            assertTrue(match.calibrated());
        }

        @Test
        @DisplayName("Soft voting should refuse members that emit margins")
        void softNeedsCalibration() {
            ClassifierOptions.Builder builder = ClassifierOptions.builder()
                    .votingMembers(List.of(ClassifierType.NAIVE_BAYES, ClassifierType.LINEAR_SVM));

            assertThrows(IllegalArgumentException.class, builder::build);
            assertEquals(VotingMode.HARD, VotingMode.fromId(" hard "));
        }
    }

    @Nested
    @DisplayName("Model metadata")
    class Metadata {

        @Test
        @DisplayName("Should record provenance of the training run")
        void provenance() {
            Model model = Classifiers.create(ClassifierType.NAIVE_BAYES, FAST).fit(TRAINING);
            ModelMetadata metadata = model.getMetadata();

            assertEquals("naive_bayes", metadata.algorithm());
            assertEquals(40, metadata.trainingSize());
            assertEquals(20, metadata.positiveCount());
            assertEquals(TrainingFixtures.SCHEMA, model.getSchema());
            assertEquals("0.1", metadata.hyperparameters().get("binarize"));
            assertNotNull(metadata.trainedAt());
        }

        @Test
        @DisplayName("Training set id should not depend on example order")
        void trainingSetIdOrderIndependent() {
            List<LabeledVector> shuffled = new ArrayList<>(TRAINING);
            Collections.reverse(shuffled);

            assertEquals(AbstractClassifier.trainingSetId(TRAINING), AbstractClassifier.trainingSetId(shuffled));
            assertNotEquals(AbstractClassifier.trainingSetId(TRAINING),
                    AbstractClassifier.trainingSetId(TRAINING.subList(0, 10)));
        }
    }

    @Nested
    @DisplayName("Invalid training input")
    class InvalidInput {

        private final Classifier classifier = Classifiers.create(ClassifierType.NAIVE_BAYES, FAST);

        @Test
        @DisplayName("Should reject an empty training set")
        void empty() {
            assertThrows(TrainingException.class, () -> classifier.fit(List.of()));
        }

        @Test
        @DisplayName("Should reject a single-class training set")
        void singleClass() {
            List<LabeledVector> onlyMatches = TRAINING.stream().filter(LabeledVector::match).toList();

            assertThrows(TrainingException.class, () -> classifier.fit(onlyMatches));
        }

        @Test
        @DisplayName("Should reject vectors of mixed schemas")
        void mixedSchemas() {
            List<LabeledVector> mixed = new ArrayList<>(TRAINING);
            mixed.add(new LabeledVector(new FeatureVector(CandidatePair.of("Qz", "Tz"),
                    FeatureSchema.of("other"), new double[]{1.0}), true));

            assertThrows(TrainingException.class, () -> classifier.fit(mixed));
        }

        @Test
        @DisplayName("Should reject non-finite feature values")
        void nonFinite() {
            List<LabeledVector> withNaN = new ArrayList<>(TRAINING);
            withNaN.add(new LabeledVector(TrainingFixtures.vector("Qn", "Tn", Double.NaN, 0.0, 0.0), false));

            assertThrows(TrainingException.class, () -> classifier.fit(withNaN));
        }
    }

    @Nested
    @DisplayName("Options and types")
    class OptionsAndTypes {

        @Test
        @DisplayName("Should resolve classifier ids leniently")
        void fromId() {
            assertEquals(ClassifierType.MULTI_LAYER_PERCEPTRON, ClassifierType.fromId("multi-layer-perceptron"));
            assertEquals(ClassifierType.NAIVE_BAYES, ClassifierType.fromId(" NAIVE_BAYES "));
            assertThrows(IllegalArgumentException.class, () -> ClassifierType.fromId("gated_ensemble"));
            assertEquals(ClassifierType.RANDOM_FOREST, ClassifierType.fromId("random-forest"));
            assertEquals(ClassifierType.VOTING, ClassifierType.fromId("voting_classifier"));
        }

        @Test
        @DisplayName("Should validate hyperparameters")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().binarizeThreshold(1.0));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().epochs(0));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().hiddenLayers(List.of()));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().hiddenLayers(List.of(8, 0)));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().forestSize(0));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder().maxTreeDepth(0));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder()
                    .votingMembers(List.of(ClassifierType.NAIVE_BAYES, ClassifierType.VOTING)));
            assertThrows(IllegalArgumentException.class, () -> ClassifierOptions.builder()
                    .votingMembers(List.of(ClassifierType.SVM, ClassifierType.SVM)));
        }

        @Test
        @DisplayName("Should create the implementation of each type")
        void factory() {
            for (ClassifierType type : ClassifierType.values()) {
                assertEquals(type, Classifiers.create(type, ClassifierOptions.defaults()).type());
            }
        }
    }
}
