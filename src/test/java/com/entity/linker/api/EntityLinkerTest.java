package com.entity.linker.api;

import com.entity.linker.baseline.LinkingRules;
import com.entity.linker.blocking.BlockingResult;
import com.entity.linker.classifier.ClassifierType;
import com.entity.linker.classifier.EvaluationReport;
import com.entity.linker.classifier.Model;
import com.entity.linker.core.exception.SchemaMismatchException;
import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.LinkLabel;
import com.entity.linker.core.model.PartialDate;
import com.entity.linker.features.FeatureSets;
import com.entity.linker.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityLinker Tests")
class EntityLinkerTest {

    private static final String[] FIRST_NAMES = {"anna", "boris", "clara", "dmitri", "elena"};
    private static final String[] LAST_NAMES = {
            "abbott", "bergstrom", "castellano", "dunmore", "eriksen",
            "fairbanks", "galloway", "hollister", "ingersoll", "jablonski"};

    private EntityLinker linker;

    @BeforeEach
    void setUp() {
        linker = EntityLinker.builder()
                .options(LinkerOptions.builder().parallelism(2).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        linker.close();
    }

    /** Ten people whose names share a first name in pairs, mirrored in both collections. */
    private static List<Entity> people(CollectionTag collection) {
        List<Entity> entities = new ArrayList<>();
        for (int i = 0; i < LAST_NAMES.length; i++) {
            String name = FIRST_NAMES[i / 2] + " " + LAST_NAMES[i];
            Entity.Builder builder = collection == CollectionTag.SOURCE ? Entity.source("Q" + i) : Entity.target("T" + i);
            entities.add(builder.name(collection == CollectionTag.SOURCE ? name.toUpperCase() : name).build());
        }
        return entities;
    }

    private static Map<String, String> confirmedLinks() {
        Map<String, String> confirmed = new LinkedHashMap<>();
        for (int i = 0; i < LAST_NAMES.length; i++) {
            confirmed.put("Q" + i, "T" + i);
        }
        return confirmed;
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Should exclude invalid entities and report them")
        void rejectsInvalid() {
            List<Entity> sources = List.of(
                    Entity.source("Q1").name("Charles Hartshorne").build(),
                    Entity.source("Q2").text(AttributeKeys.DESCRIPTION, "no name").build(),
                    Entity.source("Q1").name("Duplicate").build(),
                    Entity.target("T1").name("Wrong collection").build());

            NormalizedEntities result = linker.normalize(sources, CollectionTag.SOURCE);

            assertEquals(List.of("Q1"), result.entities().stream().map(Entity::getId).toList());
            assertEquals("charles hartshorne", result.entities().get(0).values(AttributeKeys.NAME).get(0));
            assertEquals(List.of("Q2", "Q1", "T1"), result.errors().stream().map(e -> e.entityId()).toList());
        }

        @Test
        @DisplayName("Blocking should pair entities sharing a first name token")
        void blocking() {
            List<Entity> sources = linker.normalize(people(CollectionTag.SOURCE), CollectionTag.SOURCE).entities();
            List<Entity> targets = linker.normalize(people(CollectionTag.TARGET), CollectionTag.TARGET).entities();

            BlockingResult result = linker.block(sources, targets);

            assertEquals(20, result.size());
            assertTrue(result.pairs().contains(CandidatePair.of("Q0", "T1")));
            assertFalse(result.pairs().contains(CandidatePair.of("Q0", "T2")));
        }
    }

    @Nested
    @DisplayName("Rule-based linking")
    class RuleBased {

        @Test
        @DisplayName("Should link Charles Hartshorne by perfect name")
        void hartshorne() {
            List<Entity> sources = List.of(
                    Entity.source("Q1").name("Charles Hartshorne (philosopher)")
                            .dates(AttributeKeys.BIRTH_DATE, PartialDate.ofYear(1897)).build(),
                    Entity.source("Q2").name("Karl Barth").build());
            List<Entity> targets = List.of(
                    Entity.target("T1").name("charles hartshorne")
                            .dates(AttributeKeys.BIRTH_DATE, PartialDate.ofYear(1897)).build(),
                    Entity.target("T2").name("Charles Darwin").build(),
                    Entity.target("T3").name("Karl Jaspers").build());

            LinkingResult result = linker.linkWithRules(sources, targets);

            assertEquals(3, result.decisions().size());
            assertEquals(1, result.accepted().size());
            LinkDecision accepted = result.accepted().get(0);
            assertEquals(CandidatePair.of("Q1", "T1"), accepted.pair());
            assertEquals(1.0, accepted.confidence());
            assertEquals("rule:perfect-name", accepted.strategyId());
            assertFalse(result.hasErrors());
        }

        @Test
        @DisplayName("Identical targets should be resolved to the smallest id with a warning")
        void conflict() {
            List<Entity> sources = List.of(Entity.source("Q1").name("Charles Hartshorne").build());
            List<Entity> targets = List.of(
                    Entity.target("T2").name("Charles Hartshorne").build(),
                    Entity.target("T1").name("charles  hartshorne").build());

            LinkingResult result = linker.linkWithRules(sources, targets);

            assertEquals(List.of("T1"), result.accepted().stream().map(LinkDecision::targetId).toList());
            assertEquals(1, result.warnings().size());
            assertEquals("T2", result.warnings().get(0).supersededTargetId());
        }

        @Test
        @DisplayName("Should refuse a rule the feature set cannot evaluate")
        void missingFeature() {
            try (EntityLinker links = EntityLinker.builder()
                    .options(LinkerOptions.builder().featureSet(FeatureSets.LINKS).parallelism(1).build())
                    .build()) {
                assertThrows(SchemaMismatchException.class,
                        () -> links.linkWithRules(List.of(), List.of(), LinkingRules.perfectName()));
            }
        }
    }

    @Nested
    @DisplayName("Supervised linking")
    class Supervised {

        @Test
        @DisplayName("Should build a training set from confirmed links")
        void trainingSet() {
            TrainingSet training = linker.buildTrainingSet(people(CollectionTag.SOURCE),
                    people(CollectionTag.TARGET), confirmedLinks());

            assertEquals(20, training.size());
            assertEquals(10, training.positives());
            assertTrue(training.pairErrors().isEmpty());
        }

        @Test
        @DisplayName("A trained model should link every confirmed pair and nothing else")
        void trainAndLink() {
            TrainingSet training = linker.buildTrainingSet(people(CollectionTag.SOURCE),
                    people(CollectionTag.TARGET), confirmedLinks());
            Model model = linker.train(training.examples());

            LinkingResult result = linker.link(model, people(CollectionTag.SOURCE), people(CollectionTag.TARGET));

            assertEquals(20, result.decisions().size());
            assertEquals(10, result.accepted().size());
            for (LinkDecision decision : result.accepted()) {
                assertEquals(decision.sourceId().substring(1), decision.targetId().substring(1));
                assertEquals("classifier:naive_bayes", decision.strategyId());
                assertTrue(decision.confidence() >= 0.5);
            }
            assertTrue(result.warnings().isEmpty());
        }

        @Test
        @DisplayName("Rule fast path should decide exact names before the classifier")
        void fastPath() {
            TrainingSet training = linker.buildTrainingSet(people(CollectionTag.SOURCE),
                    people(CollectionTag.TARGET), confirmedLinks());
            Model model = linker.train(training.examples());

            try (EntityLinker withRules = EntityLinker.builder()
                    .options(LinkerOptions.builder().ruleFastPath(LinkingRules.PERFECT_NAME).parallelism(1).build())
                    .build()) {
                LinkingResult result = withRules.link(model, people(CollectionTag.SOURCE), people(CollectionTag.TARGET));

                assertEquals(10, result.accepted().size());
                assertTrue(result.accepted().stream().allMatch(d -> d.strategyId().equals("rule:perfect-name")));
                assertTrue(result.decisions().stream()
                        .filter(d -> d.label() == LinkLabel.NON_MATCH)
                        .allMatch(d -> d.strategyId().equals("classifier:naive_bayes")));
            }
        }

        @Test
        @DisplayName("Should refuse a model trained on another feature set")
        void schemaMismatch() {
            Model model;
            try (EntityLinker names = EntityLinker.builder()
                    .options(LinkerOptions.builder().featureSet(FeatureSets.NAMES).parallelism(1).build())
                    .build()) {
                model = names.train(names.buildTrainingSet(people(CollectionTag.SOURCE),
                        people(CollectionTag.TARGET), confirmedLinks()).examples());
            }

            assertThrows(SchemaMismatchException.class,
                    () -> linker.link(model, people(CollectionTag.SOURCE), people(CollectionTag.TARGET)));
        }

        @Test
        @DisplayName("Cross-validation should use the configured folds and seed")
        void evaluate() {
            TrainingSet training = linker.buildTrainingSet(people(CollectionTag.SOURCE),
                    people(CollectionTag.TARGET), confirmedLinks());

            EvaluationReport report = linker.evaluate(training.examples());

            assertEquals(ClassifierType.NAIVE_BAYES.id(), report.algorithm());
            assertEquals(5, report.folds());
            assertEquals(20, report.foldAssignments().size());
            assertEquals(1.0, report.meanFScore(), 1e-9);
        }
    }

    @Test
    @DisplayName("Should record decisions and rejected entities as metrics")
    void metrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (EntityLinker metered = EntityLinker.builder()
                .options(LinkerOptions.builder().parallelism(1).build())
                .metricsService(new MicrometerMetricsService(registry))
                .build()) {
            List<Entity> sources = new ArrayList<>(people(CollectionTag.SOURCE));
            sources.add(Entity.source("Q99").build());

            metered.linkWithRules(sources, people(CollectionTag.TARGET));
        }

        assertEquals(10.0, registry.find("linker.decisions").tag("label", "MATCH").counter().count());
        assertEquals(10.0, registry.find("linker.decisions").tag("label", "NON_MATCH").counter().count());
        assertEquals(1.0, registry.find("linker.entities.rejected").tag("collection", "SOURCE").counter().count());
        assertEquals(20.0, registry.find("linker.candidates").tag("strategy", "first-token").counter().count());
    }
}
