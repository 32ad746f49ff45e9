package com.entity.linker.classifier;

import com.entity.linker.core.exception.SchemaMismatchException;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.PairError;
import com.entity.linker.parallel.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores feature vectors with a trained {@link Model}.
 */
public class SupervisedLinker {
    private static final Logger log = LoggerFactory.getLogger(SupervisedLinker.class);

    private final Model model;

    public SupervisedLinker(Model model) {
        this.model = Objects.requireNonNull(model, "model is required");
    }

    public Model getModel() {
        return model;
    }

    public String strategyId() {
        return "classifier:" + model.getType().id();
    }

    /**
     * Scores one vector.
     *
     * @throws SchemaMismatchException if the vector was not built with the model's schema
     * @throws IllegalArgumentException if the vector holds a non-finite value
     */
    public Prediction score(FeatureVector vector) {
        if (!model.getSchema().equals(vector.getSchema()) || !vector.isWellFormed()) {
            throw new SchemaMismatchException("Vector " + vector.getPair() + " has " + vector.size()
                    + " features " + vector.getSchema().names() + ", model expects "
                    + model.getSchema().names(), model.getSchema());
        }
        double[] values = vector.toArray();
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Vector " + vector.getPair() + " has a non-finite value");
            }
        }
        return model.predict(values);
    }

    public ScoringResult predict(List<FeatureVector> vectors) {
        return predict(vectors, WorkerPool.sequential());
    }

    /**
     * Scores a batch in parallel. A vector that cannot be scored becomes a {@link PairError};
     * the rest of the batch is unaffected.
     */
    public ScoringResult predict(List<FeatureVector> vectors, WorkerPool pool) {
        List<Object> outcomes = pool.map(vectors, this::scoreSafely);
        List<ScoredPair> scored = new ArrayList<>(outcomes.size());
        List<PairError> errors = new ArrayList<>();
        for (Object outcome : outcomes) {
            if (outcome instanceof ScoredPair scoredPair) {
                scored.add(scoredPair);
            } else {
                errors.add((PairError) outcome);
            }
        }
        log.debug("scoring.completed algorithm={} vectors={} errors={}",
                model.getType().id(), scored.size(), errors.size());
        return new ScoringResult(scored, errors);
    }

    private Object scoreSafely(FeatureVector vector) {
        try {
            return new ScoredPair(vector.getPair(), score(vector));
        } catch (RuntimeException e) {
            log.warn("scoring.failed pair={} error={}", vector.getPair(), e.getMessage());
            return new PairError(vector.getPair(), PairError.STAGE_SCORE, e.getMessage());
        }
    }
}
