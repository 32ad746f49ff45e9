package com.entity.linker.features;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.FeatureSchema;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.PairError;
import com.entity.linker.parallel.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns candidate pairs into fixed-width feature vectors.
 */
public class FeatureExtractor {
    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    private final FeatureSet featureSet;
    private final FeatureSchema schema;

    public FeatureExtractor(FeatureSet featureSet) {
        this.featureSet = featureSet;
        this.schema = featureSet.schema();
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public FeatureSet getFeatureSet() {
        return featureSet;
    }

    /**
     * Extracts the vector of one pair.
     *
     * @throws IllegalArgumentException if the entities do not belong to the pair
     * @throws IllegalStateException    if a feature produces a value outside [0, 1]
     */
    public FeatureVector extract(CandidatePair pair, Entity source, Entity target) {
        if (!pair.sourceId().equals(source.getId()) || !pair.targetId().equals(target.getId())) {
            throw new IllegalArgumentException("Entities " + source.getId() + "/" + target.getId()
                    + " do not belong to pair " + pair);
        }
        List<Feature> features = featureSet.features();
        double[] values = new double[features.size()];
        for (int i = 0; i < values.length; i++) {
            Feature feature = features.get(i);
            double value = feature.compute(source, target);
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalStateException("Feature " + feature.name() + " produced " + value + " for " + pair);
            }
            values[i] = value;
        }
        return new FeatureVector(pair, schema, values);
    }

    public ExtractionResult extractAll(List<CandidatePair> pairs, Map<String, Entity> sources,
                                       Map<String, Entity> targets) {
        return extractAll(pairs, sources, targets, WorkerPool.sequential());
    }

    /**
     * Extracts all pairs in parallel. A failing pair is reported as a {@link PairError}
     * and does not affect the others; vectors keep the order of {@code pairs}.
     */
    public ExtractionResult extractAll(List<CandidatePair> pairs, Map<String, Entity> sources,
                                       Map<String, Entity> targets, WorkerPool pool) {
        List<Outcome> outcomes = pool.map(pairs, pair -> extractSafely(pair, sources, targets));

        List<FeatureVector> vectors = new ArrayList<>(outcomes.size());
        List<PairError> errors = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.vector() != null) {
                vectors.add(outcome.vector());
            } else {
                errors.add(outcome.error());
            }
        }
        log.info("extraction.completed pairs={} vectors={} errors={} featureSet={}",
                pairs.size(), vectors.size(), errors.size(), featureSet.name());
        return new ExtractionResult(vectors, errors);
    }

    private Outcome extractSafely(CandidatePair pair, Map<String, Entity> sources, Map<String, Entity> targets) {
        Entity source = sources.get(pair.sourceId());
        Entity target = targets.get(pair.targetId());
        if (source == null || target == null) {
            String missing = source == null ? "source " + pair.sourceId() : "target " + pair.targetId();
            return Outcome.failed(new PairError(pair, PairError.STAGE_EXTRACT, "Unknown " + missing));
        }
        try {
            return Outcome.ok(extract(pair, source, target));
        } catch (RuntimeException e) {
            log.warn("extraction.failed pair={} error={}", pair, e.getMessage());
            return Outcome.failed(new PairError(pair, PairError.STAGE_EXTRACT, e.getMessage()));
        }
    }

    private record Outcome(FeatureVector vector, PairError error) {
        static Outcome ok(FeatureVector vector) {
            return new Outcome(vector, null);
        }

        static Outcome failed(PairError error) {
            return new Outcome(null, error);
        }
    }
}
