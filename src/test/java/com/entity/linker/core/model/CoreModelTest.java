package com.entity.linker.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core Model Tests")
class CoreModelTest {

    @Nested
    @DisplayName("PartialDate")
    class PartialDateTests {

        @Test
        @DisplayName("Should report precision from the known components")
        void precision() {
            assertEquals(DatePrecision.YEAR, PartialDate.ofYear(1897).precision());
            assertEquals(DatePrecision.MONTH, PartialDate.ofMonth(1897, 6).precision());
            assertEquals(DatePrecision.DAY, PartialDate.of(1897, 6, 5).precision());
        }

        @Test
        @DisplayName("Should reject a day without a month")
        void dayRequiresMonth() {
            assertThrows(IllegalArgumentException.class, () -> new PartialDate(1897, null, 5));
        }

        @Test
        @DisplayName("Should reject impossible calendar dates")
        void rejectsImpossibleDates() {
            assertThrows(IllegalArgumentException.class, () -> PartialDate.of(1897, 2, 30));
            assertThrows(IllegalArgumentException.class, () -> PartialDate.ofMonth(1897, 13));
        }

        @Test
        @DisplayName("Should truncate to a coarser precision only")
        void truncate() {
            PartialDate date = PartialDate.of(1897, 6, 5);
            assertEquals(PartialDate.ofYear(1897), date.truncate(DatePrecision.YEAR));
            assertEquals(PartialDate.ofMonth(1897, 6), date.truncate(DatePrecision.MONTH));
            assertEquals(PartialDate.ofYear(1897), PartialDate.ofYear(1897).truncate(DatePrecision.DAY));
        }

        @Test
        @DisplayName("Should render ISO-like text")
        void rendersText() {
            assertEquals("1897", PartialDate.ofYear(1897).toString());
            assertEquals("1897-06-05", PartialDate.of(1897, 6, 5).toString());
        }
    }

    @Nested
    @DisplayName("CandidatePair")
    class CandidatePairTests {

        @Test
        @DisplayName("Should sort by source id then target id")
        void ordering() {
            List<CandidatePair> pairs = new ArrayList<>(List.of(
                    CandidatePair.of("Q2", "T1"),
                    CandidatePair.of("Q1", "T2"),
                    CandidatePair.of("Q1", "T1")));
            Collections.sort(pairs);

            assertEquals(List.of(
                    CandidatePair.of("Q1", "T1"),
                    CandidatePair.of("Q1", "T2"),
                    CandidatePair.of("Q2", "T1")), pairs);
        }
    }

    @Nested
    @DisplayName("FeatureSchema")
    class FeatureSchemaTests {

        @Test
        @DisplayName("Should reject duplicate feature names")
        void rejectsDuplicates() {
            assertThrows(IllegalArgumentException.class, () -> FeatureSchema.of("a", "a"));
        }

        @Test
        @DisplayName("Should derive hash from the ordered names")
        void hashDependsOnOrder() {
            assertEquals(FeatureSchema.of("a", "b").hash(), FeatureSchema.of("a", "b").hash());
            assertNotEquals(FeatureSchema.of("a", "b").hash(), FeatureSchema.of("b", "a").hash());
        }

        @Test
        @DisplayName("Vectors should expose values by feature name")
        void vectorByName() {
            FeatureSchema schema = FeatureSchema.of("name_exact", "birth_date");
            FeatureVector vector = new FeatureVector(CandidatePair.of("Q1", "T1"), schema, new double[]{1.0, 0.5});

            assertEquals(0.5, vector.get("birth_date"));
            assertTrue(vector.isWellFormed());
            assertThrows(IllegalArgumentException.class, () -> vector.get("unknown"));
        }
    }

    @Nested
    @DisplayName("LinkDecision")
    class LinkDecisionTests {

        @Test
        @DisplayName("Should reject confidence outside [0, 1]")
        void rejectsInvalidConfidence() {
            CandidatePair pair = CandidatePair.of("Q1", "T1");
            assertThrows(IllegalArgumentException.class, () -> LinkDecision.match(pair, 1.5, "test"));
            assertThrows(IllegalArgumentException.class, () -> LinkDecision.match(pair, Double.NaN, "test"));
        }

        @Test
        @DisplayName("A superseded match should no longer be accepted")
        void supersededIsNotAccepted() {
            LinkDecision decision = LinkDecision.match(CandidatePair.of("Q1", "T2"), 0.7, "test");
            assertTrue(decision.isAccepted());

            LinkDecision superseded = decision.supersededBy("T1");
            assertFalse(superseded.isAccepted());
            assertEquals("T1", superseded.supersededBy());
            assertEquals(LinkLabel.MATCH, superseded.label());
        }
    }

    @Nested
    @DisplayName("Entity")
    class EntityTests {

        @Test
        @DisplayName("Should expose typed attribute values")
        void typedAttributes() {
            Entity entity = Entity.source("Q1")
                    .name("Charles Hartshorne")
                    .dates(AttributeKeys.BIRTH_DATE, PartialDate.ofYear(1897))
                    .tokens(AttributeKeys.OCCUPATION, "Q4964182")
                    .build();

            assertEquals(List.of("Charles Hartshorne"), entity.values(AttributeKeys.NAME));
            assertEquals(List.of(PartialDate.ofYear(1897)), entity.dates(AttributeKeys.BIRTH_DATE));
            assertTrue(entity.dates(AttributeKeys.NAME).isEmpty());
            assertFalse(entity.has(AttributeKeys.URL));
            assertEquals(CollectionTag.SOURCE, entity.getCollection());
        }

        @Test
        @DisplayName("Should collapse repeated token values instead of rejecting the entity")
        void repeatedTokens() {
            Entity entity = Entity.target("T2")
                    .name("x")
                    .tokens(AttributeKeys.OCCUPATION, "Q36834", "Q1", "Q36834")
                    .build();

            assertEquals(List.of("Q1", "Q36834"), entity.values(AttributeKeys.OCCUPATION));
            assertEquals(TokenSetAttribute.of("Q1", "Q36834"), TokenSetAttribute.of("Q36834", "Q1", "Q1"));
        }

        @Test
        @DisplayName("Should reject a blank id")
        void rejectsBlankId() {
            assertThrows(IllegalArgumentException.class, () -> Entity.target(" ").build());
        }
    }
}
