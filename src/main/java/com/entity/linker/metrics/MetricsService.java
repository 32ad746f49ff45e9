package com.entity.linker.metrics;

import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.LinkLabel;

import java.time.Duration;

/**
 * Records linker metrics. {@link NoOpMetricsService} is the default, so the engine runs
 * without a metrics backend.
 */
public interface MetricsService {

    void recordCandidates(String strategy, long count);

    void recordFeaturesExtracted(long vectors);

    void recordDecision(LinkLabel label);

    void recordPairError(String stage);

    void recordEntityRejected(CollectionTag collection);

    void recordTrainingDuration(ClassifierType type, Duration duration);

    void recordScoringDuration(Duration duration);

    void recordConflicts(int superseded);
}
