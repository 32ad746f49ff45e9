package com.entity.linker.features;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.FeatureSchema;
import com.entity.linker.core.model.FeatureVector;
import com.entity.linker.core.model.PairError;
import com.entity.linker.core.model.PartialDate;
import com.entity.linker.parallel.WorkerPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeatureExtractor Tests")
class FeatureExtractorTest {

    private static final Entity HARTSHORNE = Entity.source("Q1")
            .name("charles hartshorne")
            .dates(AttributeKeys.BIRTH_DATE, PartialDate.ofYear(1897))
            .build();

    private static final Entity HARTSHORNE_TARGET = Entity.target("T1")
            .name("charles hartshorne")
            .dates(AttributeKeys.BIRTH_DATE, PartialDate.of(1897, 6, 5))
            .build();

    private final FeatureExtractor extractor = new FeatureExtractor(FeatureSets.defaultSet(OccupationHierarchy.FLAT));

    @Nested
    @DisplayName("Feature sets")
    class FeatureSetTests {

        @Test
        @DisplayName("Default set should have a fixed column order")
        void defaultSchema() {
            FeatureSchema schema = extractor.getSchema();

            assertEquals(14, schema.size());
            assertEquals(0, schema.indexOf(FeatureSets.NAME_EXACT));
            assertEquals(6, schema.indexOf(FeatureSets.BIRTH_DATE));
            assertEquals(FeatureSets.DESCRIPTION_TOKENS, schema.names().get(13));
        }

        @Test
        @DisplayName("Should create sets by name and reject unknown names")
        void byName() {
            assertEquals(FeatureSets.NAMES, FeatureSets.create(FeatureSets.NAMES, OccupationHierarchy.FLAT).name());
            assertEquals(3, FeatureSets.create(FeatureSets.LINKS, OccupationHierarchy.FLAT).features().size());
            assertThrows(IllegalArgumentException.class, () -> FeatureSets.create("nope", OccupationHierarchy.FLAT));
        }

        @Test
        @DisplayName("Schema hash should be stable across instances")
        void stableHash() {
            assertEquals(extractor.getSchema().hash(),
                    FeatureSets.defaultSet(OccupationHierarchy.FLAT).schema().hash());
        }
    }

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        @DisplayName("Should encode an identical name and compatible birth date as 1.0")
        void hartshorne() {
            FeatureVector vector = extractor.extract(CandidatePair.of("Q1", "T1"), HARTSHORNE, HARTSHORNE_TARGET);

            assertEquals(1.0, vector.get(FeatureSets.NAME_EXACT));
            assertEquals(1.0, vector.get(FeatureSets.BIRTH_DATE));
            assertEquals(0.0, vector.get(FeatureSets.DEATH_DATE));
            assertEquals(0.0, vector.get(FeatureSets.URL_EXACT));
        }

        @Test
        @DisplayName("Every value should be within [0, 1]")
        void valuesInRange() {
            Entity target = Entity.target("T2")
                    .name("karl barth")
                    .links(AttributeKeys.URL, "https://example.com/barth")
                    .tokens(AttributeKeys.GENRE, "theology")
                    .build();

            FeatureVector vector = extractor.extract(CandidatePair.of("Q1", "T2"), HARTSHORNE, target);

            for (double value : vector.toArray()) {
                assertTrue(value >= 0.0 && value <= 1.0, "value out of range: " + value);
            }
        }

        @Test
        @DisplayName("Extraction should be deterministic")
        void deterministic() {
            CandidatePair pair = CandidatePair.of("Q1", "T1");
            assertEquals(extractor.extract(pair, HARTSHORNE, HARTSHORNE_TARGET),
                    extractor.extract(pair, HARTSHORNE, HARTSHORNE_TARGET));
        }

        @Test
        @DisplayName("Should reject entities that do not belong to the pair")
        void wrongEntities() {
            assertThrows(IllegalArgumentException.class,
                    () -> extractor.extract(CandidatePair.of("Q9", "T1"), HARTSHORNE, HARTSHORNE_TARGET));
        }
    }

    @Nested
    @DisplayName("Batch extraction")
    class Batch {

        @Test
        @DisplayName("Unknown entities should become pair errors")
        void unknownEntity() {
            ExtractionResult result = extractor.extractAll(
                    List.of(CandidatePair.of("Q1", "T1"), CandidatePair.of("Q1", "T404")),
                    Map.of("Q1", HARTSHORNE), Map.of("T1", HARTSHORNE_TARGET));

            assertEquals(1, result.vectors().size());
            assertEquals(1, result.errors().size());
            PairError error = result.errors().get(0);
            assertEquals(CandidatePair.of("Q1", "T404"), error.pair());
            assertEquals(PairError.STAGE_EXTRACT, error.stage());
        }

        @Test
        @DisplayName("A feature out of range should fail only its pair")
        void faultyFeature() {
            Feature faulty = new Feature() {
                @Override
                public String name() {
                    return "faulty";
                }

                @Override
                public double compute(Entity source, Entity target) {
                    return target.getId().equals("T2") ? 2.0 : 0.5;
                }
            };
            FeatureExtractor faultyExtractor = new FeatureExtractor(new FeatureSet("faulty", List.of(faulty)));
            Entity second = Entity.target("T2").name("x").build();

            ExtractionResult result = faultyExtractor.extractAll(
                    List.of(CandidatePair.of("Q1", "T1"), CandidatePair.of("Q1", "T2")),
                    Map.of("Q1", HARTSHORNE), Map.of("T1", HARTSHORNE_TARGET, "T2", second));

            assertEquals(List.of(CandidatePair.of("Q1", "T1")),
                    result.vectors().stream().map(FeatureVector::getPair).toList());
            assertTrue(result.hasErrors());
        }

        @Test
        @DisplayName("Parallel extraction should keep pair order")
        void parallelOrder() {
            Map<String, Entity> sources = new LinkedHashMap<>();
            Map<String, Entity> targets = new LinkedHashMap<>();
            List<CandidatePair> pairs = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                sources.put("Q" + i, Entity.source("Q" + i).name("person " + i).build());
                targets.put("T" + i, Entity.target("T" + i).name("person " + (i % 7)).build());
                pairs.add(CandidatePair.of("Q" + i, "T" + i));
            }

            ExtractionResult sequential = extractor.extractAll(pairs, sources, targets);
            ExtractionResult parallel;
            try (WorkerPool pool = new WorkerPool(3)) {
                parallel = extractor.extractAll(pairs, sources, targets, pool);
            }

            assertEquals(sequential.vectors(), parallel.vectors());
        }
    }
}
