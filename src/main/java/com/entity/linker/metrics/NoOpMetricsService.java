package com.entity.linker.metrics;

import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.LinkLabel;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCandidates(String strategy, long count) {
    }

    @Override
    public void recordFeaturesExtracted(long vectors) {
    }

    @Override
    public void recordDecision(LinkLabel label) {
    }

    @Override
    public void recordPairError(String stage) {
    }

    @Override
    public void recordEntityRejected(CollectionTag collection) {
    }

    @Override
    public void recordTrainingDuration(ClassifierType type, Duration duration) {
    }

    @Override
    public void recordScoringDuration(Duration duration) {
    }

    @Override
    public void recordConflicts(int superseded) {
    }
}
