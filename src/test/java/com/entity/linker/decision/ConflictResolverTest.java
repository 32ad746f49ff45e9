package com.entity.linker.decision;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.LinkDecision;
import com.entity.linker.core.model.PairConflictWarning;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConflictResolver Tests")
class ConflictResolverTest {

    private static final String STRATEGY = "classifier:svm";
    private final ConflictResolver resolver = new ConflictResolver();

    @Test
    @DisplayName("Should keep only the highest-confidence match of a source")
    void highestConfidenceWins() {
        LinkDecision weaker = LinkDecision.match(CandidatePair.of("Q1", "T1"), 0.7, STRATEGY);
        LinkDecision stronger = LinkDecision.match(CandidatePair.of("Q1", "T2"), 0.9, STRATEGY);

        ConflictResolution resolution = resolver.resolve(List.of(weaker, stronger));

        List<LinkDecision> decisions = resolution.decisions();
        assertEquals(CandidatePair.of("Q1", "T1"), decisions.get(0).pair());
        assertEquals("T2", decisions.get(0).supersededBy());
        assertFalse(decisions.get(0).isAccepted());
        assertTrue(decisions.get(1).isAccepted());
        assertEquals(List.of(new PairConflictWarning("Q1", "T2", "T1", 0.9, 0.7)), resolution.warnings());
    }

    @Test
    @DisplayName("Ties should go to the smallest target id")
    void tieBreak() {
        ConflictResolution resolution = resolver.resolve(List.of(
                LinkDecision.match(CandidatePair.of("Q1", "T9"), 0.8, STRATEGY),
                LinkDecision.match(CandidatePair.of("Q1", "T3"), 0.8, STRATEGY)));

        LinkDecision accepted = resolution.decisions().stream().filter(LinkDecision::isAccepted).findFirst().orElseThrow();
        assertEquals("T3", accepted.targetId());
    }

    @Test
    @DisplayName("A decision with confidence should beat one without")
    void confidenceBeatsNull() {
        ConflictResolution resolution = resolver.resolve(List.of(
                LinkDecision.match(CandidatePair.of("Q1", "T1"), null, "rule:perfect-name"),
                LinkDecision.match(CandidatePair.of("Q1", "T2"), 0.6, STRATEGY)));

        assertEquals(List.of("T2"), resolution.decisions().stream()
                .filter(LinkDecision::isAccepted).map(LinkDecision::targetId).toList());
    }

    @Test
    @DisplayName("Non-matches and other sources should be untouched")
    void untouched() {
        List<LinkDecision> input = List.of(
                LinkDecision.match(CandidatePair.of("Q2", "T1"), 0.9, STRATEGY),
                LinkDecision.nonMatch(CandidatePair.of("Q1", "T1"), 0.2, STRATEGY),
                LinkDecision.match(CandidatePair.of("Q1", "T2"), 0.6, STRATEGY));

        ConflictResolution resolution = resolver.resolve(input);

        assertTrue(resolution.warnings().isEmpty());
        assertEquals(List.of(CandidatePair.of("Q1", "T1"), CandidatePair.of("Q1", "T2"), CandidatePair.of("Q2", "T1")),
                resolution.decisions().stream().map(LinkDecision::pair).toList());
        assertTrue(resolution.decisions().stream().noneMatch(LinkDecision::isSuperseded));
    }

    @Test
    @DisplayName("Each source should end with at most one accepted match")
    void atMostOnePerSource() {
        ConflictResolution resolution = resolver.resolve(List.of(
                LinkDecision.match(CandidatePair.of("Q1", "T1"), 0.51, STRATEGY),
                LinkDecision.match(CandidatePair.of("Q1", "T2"), 0.52, STRATEGY),
                LinkDecision.match(CandidatePair.of("Q1", "T3"), 0.53, STRATEGY),
                LinkDecision.match(CandidatePair.of("Q2", "T1"), 0.99, STRATEGY)));

        assertEquals(1, resolution.decisions().stream()
                .filter(d -> d.sourceId().equals("Q1") && d.isAccepted()).count());
        assertEquals(2, resolution.warnings().size());
        assertEquals("T1", resolution.warnings().get(0).supersededTargetId());
    }

    @Test
    @DisplayName("Should reject a pair decided twice")
    void duplicatePair() {
        LinkDecision decision = LinkDecision.match(CandidatePair.of("Q1", "T1"), 0.9, STRATEGY);

        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(List.of(decision, decision)));
    }
}
