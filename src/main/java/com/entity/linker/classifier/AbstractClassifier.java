package com.entity.linker.classifier;

import com.entity.linker.core.exception.TrainingException;
import com.entity.linker.core.model.FeatureSchema;
import com.entity.linker.core.model.LabeledVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Random;

/**
 * Validates training input, builds the design matrix and wraps learned parameters
 * into a {@link Model}. Subclasses only implement {@link #train(TrainingData)}.
 */
public abstract class AbstractClassifier implements Classifier {

    private static final Logger log = LoggerFactory.getLogger(AbstractClassifier.class);

    protected final ClassifierOptions options;

    protected AbstractClassifier(ClassifierOptions options) {
        this.options = options != null ? options : ClassifierOptions.defaults();
    }

    public ClassifierOptions getOptions() {
        return options;
    }

    @Override
    public final Model fit(List<LabeledVector> examples) {
        FeatureSchema schema = validate(examples);
        TrainingData data = toTrainingData(examples, schema);

        long start = System.nanoTime();
        ModelParameters parameters;
        try {
            parameters = train(data);
        } catch (TrainingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrainingException("Training " + type().id() + " failed: " + e.getMessage(), e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        ModelMetadata metadata = new ModelMetadata(
                type().id(),
                Instant.now(),
                trainingSetId(examples),
                data.size(),
                data.positives(),
                options.describe(type()));
        log.info("training.completed algorithm={} examples={} positives={} features={} durationMs={}",
                type().id(), data.size(), data.positives(), schema.size(), elapsedMs);
        return new Model(type(), schema, parameters, metadata);
    }

    /**
     * Learns parameters from validated data. Must be deterministic for a given seed.
     */
    protected abstract ModelParameters train(TrainingData data);

    protected Random random() {
        return new Random(options.getSeed());
    }

    private FeatureSchema validate(List<LabeledVector> examples) {
        if (examples == null || examples.isEmpty()) {
            throw new TrainingException("Training set is empty");
        }
        FeatureSchema schema = examples.get(0).vector().getSchema();
        boolean hasMatch = false;
        boolean hasNonMatch = false;
        for (LabeledVector example : examples) {
            if (!schema.equals(example.vector().getSchema()) || !example.vector().isWellFormed()) {
                throw new TrainingException("Training vector " + example.pair()
                        + " does not follow schema " + schema.names());
            }
            for (double value : example.vector().toArray()) {
                if (!Double.isFinite(value)) {
                    throw new TrainingException("Training vector " + example.pair() + " has a non-finite value");
                }
            }
            if (example.match()) {
                hasMatch = true;
            } else {
                hasNonMatch = true;
            }
        }
        if (!hasMatch || !hasNonMatch) {
            throw new TrainingException("Training set must contain both matches and non-matches");
        }
        return schema;
    }

    private static TrainingData toTrainingData(List<LabeledVector> examples, FeatureSchema schema) {
        double[][] inputs = new double[examples.size()][];
        int[] labels = new int[examples.size()];
        for (int i = 0; i < examples.size(); i++) {
            inputs[i] = examples.get(i).vector().toArray();
            labels[i] = examples.get(i).match() ? 1 : 0;
        }
        return new TrainingData(inputs, labels);
    }

    static String trainingSetId(List<LabeledVector> examples) {
        List<LabeledVector> sorted = new ArrayList<>(examples);
        sorted.sort(Comparator.comparing(LabeledVector::pair));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (LabeledVector example : sorted) {
                String line = example.pair().sourceId() + "\t" + example.pair().targetId()
                        + "\t" + (example.match() ? 1 : 0) + "\n";
                digest.update(line.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
