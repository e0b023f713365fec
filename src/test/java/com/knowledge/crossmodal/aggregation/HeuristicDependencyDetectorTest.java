package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Stance;
import com.knowledge.crossmodal.error.DependencyDetectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HeuristicDependencyDetector Tests")
class HeuristicDependencyDetectorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private final HeuristicDependencyDetector detector = new HeuristicDependencyDetector();

    private static EvidenceItem.Builder item(String id, String source) {
        return EvidenceItem.builder().evidenceId(id).sourceId(source).confidence(0.8);
    }

    @Nested
    @DisplayName("Pairwise heuristics")
    class PairTests {

        @Test
        @DisplayName("Shared tag links the pair at full strength")
        void sharedTag() {
            List<DependencyLink> links = detector.detect(List.of(
                    item("e1", "a").dependencyTag("ap-42").build(),
                    item("e2", "b").dependencyTag("ap-42").build()), List.of());

            assertEquals(List.of(DependencyLink.of("e1", "e2", DependencyKind.SHARED_TAG, 1.0)), links);
        }

        @Test
        @DisplayName("Shared source links the pair at full strength")
        void sharedSource() {
            List<DependencyLink> links = detector.detect(List.of(item("e1", "a").build(), item("e2", "a").build()),
                    List.of());

            assertEquals(1, links.size());
            assertEquals(DependencyKind.SHARED_SOURCE, links.get(0).kind());
        }

        @Test
        @DisplayName("Citation overlap at the threshold links with the overlap as strength")
        void citationOverlap() {
            List<DependencyLink> links = detector.detect(List.of(
                    item("e1", "a").citations(Set.of("x", "y")).build(),
                    item("e2", "b").citations(Set.of("y", "z")).build()), List.of());

            assertEquals(1, links.size());
            assertEquals(DependencyKind.CITATION_OVERLAP, links.get(0).kind());
            assertEquals(1.0 / 3.0, links.get(0).strength(), 1e-12);
        }

        @Test
        @DisplayName("Citation overlap below the threshold is ignored")
        void weakCitationOverlapIgnored() {
            List<DependencyLink> links = detector.detect(List.of(
                    item("e1", "a").citations(Set.of("x", "y", "z")).build(),
                    item("e2", "b").citations(Set.of("z", "v", "w")).build()), List.of());

            assertTrue(links.isEmpty());
        }

        @Test
        @DisplayName("Citing the other source within the window is a cascade")
        void temporalCascade() {
            List<DependencyLink> links = detector.detect(List.of(
                    item("e1", "origin").observedAt(T0).build(),
                    item("e2", "echo").observedAt(T0.plus(Duration.ofHours(2))).citations(Set.of("origin")).build()),
                    List.of());

            assertEquals(List.of(DependencyLink.of("e1", "e2", DependencyKind.TEMPORAL_CASCADE, 0.75)), links);
        }

        @Test
        @DisplayName("No cascade outside the window or across stances")
        void noCascadeOutsideWindowOrStance() {
            List<DependencyLink> late = detector.detect(List.of(
                    item("e1", "origin").observedAt(T0).build(),
                    item("e2", "echo").observedAt(T0.plus(Duration.ofHours(7))).citations(Set.of("origin")).build()),
                    List.of());
            List<DependencyLink> opposed = detector.detect(List.of(
                    item("e1", "origin").observedAt(T0).build(),
                    item("e2", "echo").observedAt(T0.plusSeconds(60)).stance(Stance.CONTRADICTS)
                            .citations(Set.of("origin")).build()),
                    List.of());

            assertTrue(late.isEmpty());
            assertTrue(opposed.isEmpty());
        }

        @Test
        @DisplayName("Unrelated evidence yields no links")
        void unrelated() {
            assertTrue(detector.detect(List.of(item("e1", "a").build(), item("e2", "b").build()), List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Declarations")
    class DeclarationTests {

        @Test
        @DisplayName("Declared group links every pair")
        void declaredGroup() {
            List<DependencyLink> links = detector.detect(
                    List.of(item("e1", "a").build(), item("e2", "b").build(), item("e3", "c").build()),
                    List.of(new DependencyDeclaration(Set.of("e3", "e1", "e2"), "syndicated", T0)));

            assertEquals(3, links.size());
            assertTrue(links.stream().allMatch(l -> l.kind() == DependencyKind.DECLARED && l.strength() == 1.0));
        }

        @Test
        @DisplayName("Declaration naming unknown evidence fails detection")
        void unknownDeclaredEvidence() {
            assertThrows(DependencyDetectionException.class, () -> detector.detect(
                    List.of(item("e1", "a").build(), item("e2", "b").build()),
                    List.of(new DependencyDeclaration(Set.of("e1", "e9"), "syndicated", T0))));
        }

        @Test
        @DisplayName("Duplicate evidence ids fail detection")
        void duplicateEvidence() {
            DependencyDetectionException ex = assertThrows(DependencyDetectionException.class,
                    () -> detector.detect(List.of(item("e1", "a").build(), item("e1", "b").build()), List.of()));
            assertTrue(ex.getProvenance().evidenceIds().contains("e1"));
        }
    }

    @Test
    @DisplayName("Links are undirected and store ids in ascending order")
    void linksAreOrdered() {
        DependencyLink link = DependencyLink.of("e9", "e2", DependencyKind.SHARED_TAG, 1.0);

        assertEquals("e2", link.firstEvidenceId());
        assertEquals("e9", link.secondEvidenceId());
        assertThrows(IllegalArgumentException.class, () -> DependencyLink.of("e1", "e1", DependencyKind.DECLARED, 1.0));
        assertThrows(IllegalArgumentException.class, () -> DependencyLink.of("e1", "e2", DependencyKind.DECLARED, 0.0));
    }
}
