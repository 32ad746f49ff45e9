package com.entity.linker.metrics;

import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.LinkLabel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code linker.candidates}: counter, tag {@code strategy}</li>
 *   <li>{@code linker.features.extracted}: counter</li>
 *   <li>{@code linker.decisions}: counter, tag {@code label}</li>
 *   <li>{@code linker.pair.errors}: counter, tag {@code stage}</li>
 *   <li>{@code linker.entities.rejected}: counter, tag {@code collection}</li>
 *   <li>{@code linker.training.duration}: timer, tag {@code algorithm}</li>
 *   <li>{@code linker.scoring.duration}: timer</li>
 *   <li>{@code linker.conflicts}: counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> trainingTimers = new ConcurrentHashMap<>();
    private final Counter featuresExtracted;
    private final Counter conflicts;
    private final Timer scoringTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.featuresExtracted = Counter.builder("linker.features.extracted")
                .description("Feature vectors extracted")
                .register(registry);
        this.conflicts = Counter.builder("linker.conflicts")
                .description("Matches superseded by a higher-confidence match of the same source")
                .register(registry);
        this.scoringTimer = Timer.builder("linker.scoring.duration")
                .description("Duration of scoring a batch of feature vectors")
                .register(registry);
    }

    @Override
    public void recordCandidates(String strategy, long count) {
        counter("linker.candidates", "strategy", strategy, "Candidate pairs produced by blocking")
                .increment(count);
    }

    @Override
    public void recordFeaturesExtracted(long vectors) {
        featuresExtracted.increment(vectors);
    }

    @Override
    public void recordDecision(LinkLabel label) {
        counter("linker.decisions", "label", label.name(), "Link decisions by label").increment();
    }

    @Override
    public void recordPairError(String stage) {
        counter("linker.pair.errors", "stage", stage, "Pairs that failed a pipeline stage").increment();
    }

    @Override
    public void recordEntityRejected(CollectionTag collection) {
        counter("linker.entities.rejected", "collection", collection.name(), "Entities rejected by normalization")
                .increment();
    }

    @Override
    public void recordTrainingDuration(ClassifierType type, Duration duration) {
        trainingTimers.computeIfAbsent(type.id(), id ->
                Timer.builder("linker.training.duration")
                        .description("Duration of model training")
                        .tag("algorithm", id)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordScoringDuration(Duration duration) {
        scoringTimer.record(duration);
    }

    @Override
    public void recordConflicts(int superseded) {
        conflicts.increment(superseded);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counters.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
