package com.entity.linker.metrics;

import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.LinkLabel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should execute without errors")
        void allMethodsNoErrors() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCandidates("first-token", 10);
                noOp.recordFeaturesExtracted(10);
                noOp.recordDecision(LinkLabel.MATCH);
                noOp.recordPairError("extract");
                noOp.recordEntityRejected(CollectionTag.SOURCE);
                noOp.recordTrainingDuration(ClassifierType.NAIVE_BAYES, Duration.ofMillis(5));
                noOp.recordScoringDuration(Duration.ofMillis(5));
                noOp.recordConflicts(2);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService service;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            service = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Should count candidates per strategy")
        void candidates() {
            service.recordCandidates("first-token", 12);
            service.recordCandidates("first-token", 3);
            service.recordCandidates("exact-url", 1);

            assertEquals(15.0, registry.find("linker.candidates").tag("strategy", "first-token").counter().count());
            assertEquals(1.0, registry.find("linker.candidates").tag("strategy", "exact-url").counter().count());
        }

        @Test
        @DisplayName("Should count decisions by label")
        void decisions() {
            service.recordDecision(LinkLabel.MATCH);
            service.recordDecision(LinkLabel.MATCH);
            service.recordDecision(LinkLabel.UNDECIDED);

            assertEquals(2.0, registry.find("linker.decisions").tag("label", "MATCH").counter().count());
            assertEquals(1.0, registry.find("linker.decisions").tag("label", "UNDECIDED").counter().count());
            assertNull(registry.find("linker.decisions").tag("label", "NON_MATCH").counter());
        }

        @Test
        @DisplayName("Should count errors, rejections, vectors and conflicts")
        void counters() {
            service.recordPairError("score");
            service.recordEntityRejected(CollectionTag.TARGET);
            service.recordFeaturesExtracted(40);
            service.recordConflicts(3);

            assertEquals(1.0, registry.find("linker.pair.errors").tag("stage", "score").counter().count());
            assertEquals(1.0, registry.find("linker.entities.rejected").tag("collection", "TARGET").counter().count());
            Counter extracted = registry.find("linker.features.extracted").counter();
            assertEquals(40.0, extracted.count());
            assertEquals(3.0, registry.find("linker.conflicts").counter().count());
        }

        @Test
        @DisplayName("Should time training per algorithm and scoring")
        void timers() {
            service.recordTrainingDuration(ClassifierType.LINEAR_SVM, Duration.ofMillis(120));
            service.recordTrainingDuration(ClassifierType.LINEAR_SVM, Duration.ofMillis(80));
            service.recordScoringDuration(Duration.ofMillis(7));

            Timer training = registry.find("linker.training.duration").tag("algorithm", "linear_svm").timer();
            assertNotNull(training);
            assertEquals(2, training.count());
            assertEquals(200.0, training.totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, registry.find("linker.scoring.duration").timer().count());
        }
    }
}
