package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.core.model.Stance;
import com.knowledge.crossmodal.error.DependencyDetectionException;
import com.knowledge.crossmodal.error.InsufficientEvidenceException;
import com.knowledge.crossmodal.error.Provenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("BayesianAggregator Tests")
class BayesianAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final BayesianAggregator aggregator = new BayesianAggregator();

    private static EvidenceItem item(String id, String source, double confidence) {
        return EvidenceItem.builder().evidenceId(id).sourceId(source).confidence(confidence).build();
    }

    private static EvidenceItem against(String id, String source, double confidence) {
        return EvidenceItem.builder().evidenceId(id).sourceId(source).confidence(confidence)
                .stance(Stance.CONTRADICTS).build();
    }

    private static DependencyDeclaration declared(String... ids) {
        return new DependencyDeclaration(Set.of(ids), "same wire report", NOW);
    }

    @Nested
    @DisplayName("Independent evidence")
    class IndependentTests {

        @Test
        @DisplayName("Three independent sources combine in closed form")
        void threeIndependentSources() {
            AuditTrail trail = aggregator.aggregate("c-1",
                    List.of(item("e1", "reuters", 0.8), item("e2", "bloomberg", 0.75), item("e3", "apple.com", 0.9)),
                    List.of(), NOW);

            assertEquals(0.9908, trail.posterior(), 1e-4);
            assertEquals(AuditTrail.METHOD_CLOSED_FORM, trail.method());
            assertEquals(AuditTrail.METHOD_VERSION, trail.methodVersion());
            assertFalse(trail.lowerTrust());
            assertTrue(trail.links().isEmpty());
        }

        @Test
        @DisplayName("A single item reproduces its own confidence under the neutral prior")
        void singleItemKeepsConfidence() {
            AuditTrail trail = aggregator.aggregate("c-1", List.of(item("e1", "reuters", 0.8)), List.of(), NOW);

            assertEquals(0.8, trail.posterior(), 1e-12);
        }

        @Test
        @DisplayName("Equal support and contradiction cancel out")
        void contradictionCancelsSupport() {
            AuditTrail trail = aggregator.aggregate("c-1",
                    List.of(item("e1", "reuters", 0.8), against("e2", "bloomberg", 0.8)), List.of(), NOW);

            assertEquals(0.5, trail.posterior(), 1e-12);
        }

        @Test
        @DisplayName("Certain evidence is clamped away from 0 and 1")
        void certaintyIsClamped() {
            AuditTrail trail = aggregator.aggregate("c-1", List.of(item("e1", "reuters", 1.0)), List.of(), NOW);

            assertTrue(trail.posterior() < 1.0);
            assertEquals(0.999, trail.posterior(), 1e-9);
        }

        @Test
        @DisplayName("Empty evidence is rejected")
        void emptyEvidenceRejected() {
            InsufficientEvidenceException ex = assertThrows(InsufficientEvidenceException.class,
                    () -> aggregator.aggregate("c-1", List.of(), List.of(), NOW));
            assertEquals("c-1", ex.getClaimId());
        }
    }

    @Nested
    @DisplayName("Dependent evidence")
    class DependentTests {

        @Test
        @DisplayName("Declared dependency discounts the pair to one voice")
        void declaredPairCountsOnce() {
            List<EvidenceItem> evidence = List.of(
                    item("e1", "reuters", 0.8), item("e2", "bloomberg", 0.75), item("e3", "apple.com", 0.9));

            AuditTrail independent = aggregator.aggregate("c-1", evidence, List.of(), NOW);
            AuditTrail dependent = aggregator.aggregate("c-1", evidence, List.of(declared("e1", "e2")), NOW);

            assertEquals(36.0 / 37.0, dependent.posterior(), 1e-9);
            assertTrue(dependent.posterior() < independent.posterior());
            assertTrue(dependent.isClustered());
            assertEquals(2, dependent.clusters().size());

            EvidenceCluster pair = dependent.clusters().get(0);
            assertEquals(List.of("e1", "e2"), pair.evidenceIds());
            assertEquals(1.0, pair.strength());
            assertEquals(BayesianAggregator.logit(0.8) + BayesianAggregator.logit(0.75), pair.logOdds(), 1e-12);
            assertEquals(BayesianAggregator.logit(0.8), pair.weightedLogOdds(), 1e-12);
            assertTrue(pair.weight() < 1.0);
        }

        @Test
        @DisplayName("Shared dependency tag collapses duplicates of the same report")
        void sharedTagCollapses() {
            List<EvidenceItem> evidence = new ArrayList<>();
            for (int i = 1; i <= 4; i++) {
                evidence.add(EvidenceItem.builder().evidenceId("e" + i).sourceId("outlet-" + i)
                        .confidence(0.8).dependencyTag("wire-123").build());
            }

            AuditTrail trail = aggregator.aggregate("c-1", evidence, List.of(), NOW);

            assertEquals(1, trail.clusters().size());
            assertEquals(0.8, trail.posterior(), 1e-9);
        }

        @Test
        @DisplayName("Partially dependent items count by one minus the link strength")
        void partialDependenceDiscountsWeakerItems() {
            EvidenceItem first = EvidenceItem.builder().evidenceId("e1").sourceId("a").confidence(0.9)
                    .citations(Set.of("x", "y")).build();
            EvidenceItem second = EvidenceItem.builder().evidenceId("e2").sourceId("b").confidence(0.75)
                    .citations(Set.of("x", "y", "z", "w")).build();

            AuditTrail trail = aggregator.aggregate("c-1", List.of(first, second), List.of(), NOW);

            assertEquals(1, trail.clusters().size());
            EvidenceCluster cluster = trail.clusters().get(0);
            double expected = BayesianAggregator.logit(0.9) + (1.0 - cluster.strength()) * BayesianAggregator.logit(0.75);
            assertTrue(cluster.strength() > 0.0 && cluster.strength() < 1.0);
            assertEquals(expected, cluster.weightedLogOdds(), 1e-12);
        }

        @Test
        @DisplayName("A shared source does not cluster items with opposite stances")
        void oppositeStancesStaySeparate() {
            AuditTrail trail = aggregator.aggregate("c-1",
                    List.of(item("e1", "reuters", 0.8), against("e2", "reuters", 0.8)), List.of(), NOW);

            assertEquals(2, trail.clusters().size());
            assertEquals(0.5, trail.posterior(), 1e-12);
        }

        @Test
        @DisplayName("Running posteriors end at the final posterior")
        void runningPosteriorsEndAtFinal() {
            AuditTrail trail = aggregator.aggregate("c-1",
                    List.of(item("e1", "a", 0.7), item("e2", "b", 0.6), item("e3", "c", 0.9), item("e4", "d", 0.55)),
                    List.of(), NOW);

            assertEquals(trail.clusters().size(), trail.runningPosteriors().size());
            assertEquals(trail.posterior(), trail.runningPosteriors().get(trail.runningPosteriors().size() - 1));
        }
    }

    @Nested
    @DisplayName("Determinism")
    class DeterminismTests {

        @ParameterizedTest(name = "seed {0}")
        @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
        @DisplayName("Submission order does not change the posterior")
        void orderIndependent(long seed) {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(
                    item("e1", "reuters", 0.8), item("e2", "reuters", 0.65), against("e3", "blog", 0.6),
                    item("e4", "bloomberg", 0.9), item("e5", "wsj", 0.72)));
            List<DependencyDeclaration> declarations = List.of(declared("e4", "e5"));
            AuditTrail reference = aggregator.aggregate("c-1", evidence, declarations, NOW);

            Collections.shuffle(evidence, new Random(seed));
            AuditTrail shuffled = aggregator.aggregate("c-1", evidence, declarations, NOW);

            assertEquals(reference.posterior(), shuffled.posterior());
            assertTrue(reference.sameResult(shuffled));
        }

        @ParameterizedTest(name = "adding confidence {0}")
        @ValueSource(doubles = {0.51, 0.6, 0.75, 0.9, 0.99})
        @DisplayName("Adding independent supporting evidence never lowers the posterior")
        void monotoneInSupport(double confidence) {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(
                    item("e1", "reuters", 0.7), against("e2", "blog", 0.65), item("e3", "wsj", 0.55)));
            double before = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            evidence.add(item("e9", "independent-outlet", confidence));
            double after = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            assertTrue(after > before, "posterior should rise from " + before + " but was " + after);
        }

        static Stream<Arguments> addedItems() {
            return Stream.of(
                    Arguments.of("independent contradiction", against("e9", "independent-outlet", 0.6), false),
                    Arguments.of("contradiction from a contradicting source", against("e9", "b", 0.6), false),
                    Arguments.of("strong contradiction from a contradicting source", against("e9", "b", 0.97), false),
                    Arguments.of("contradiction from the supporting source", against("e9", "a", 0.7), false),
                    Arguments.of("contradiction sharing a tag", EvidenceItem.builder().evidenceId("e9").sourceId("c")
                            .confidence(0.8).stance(Stance.CONTRADICTS).dependencyTag("wire-1").build(), false),
                    Arguments.of("support from the supporting source", item("e9", "a", 0.6), true),
                    Arguments.of("strong support from the supporting source", item("e9", "a", 0.99), true),
                    Arguments.of("support from a contradicting source", item("e9", "b", 0.7), true),
                    Arguments.of("support sharing a tag", EvidenceItem.builder().evidenceId("e9").sourceId("d")
                            .confidence(0.85).dependencyTag("wire-1").build(), true));
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("addedItems")
        @DisplayName("Adding an item never moves the posterior against its own stance")
        void monotoneInEitherStance(String label, EvidenceItem added, boolean supports) {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(
                    item("e1", "a", 0.95),
                    against("e2", "b", 0.9),
                    against("e3", "b", 0.9),
                    EvidenceItem.builder().evidenceId("e4").sourceId("c").confidence(0.7)
                            .dependencyTag("wire-1").build()));
            List<DependencyDeclaration> declarations = List.of(declared("e1", "e4"));
            double before = aggregator.aggregate("c-1", evidence, declarations, NOW).posterior();

            evidence.add(added);
            double after = aggregator.aggregate("c-1", evidence, declarations, NOW).posterior();

            if (supports) {
                assertTrue(after >= before, "posterior fell from " + before + " to " + after);
            } else {
                assertTrue(after <= before, "posterior rose from " + before + " to " + after);
            }
        }

        @Test
        @DisplayName("An item repeating a dependent contradiction does not raise the posterior")
        void dependentContradictionNeverRaises() {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(
                    item("e1", "a", 0.95), against("e2", "b", 0.9), against("e3", "b", 0.9)));
            double before = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            evidence.add(against("e4", "b", 0.6));
            double after = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            assertTrue(after <= before, "posterior rose from " + before + " to " + after);
        }

        @Test
        @DisplayName("Weaker support from the same source keeps the posterior")
        void dependentSupportNeverLowers() {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(item("e1", "a", 0.9)));
            double before = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            evidence.add(item("e2", "a", 0.6));
            double after = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            assertEquals(before, after, 1e-12);
            assertEquals(0.9, after, 1e-12);
        }

        @Test
        @DisplayName("Independent contradicting evidence lowers the posterior")
        void independentContradictionLowers() {
            List<EvidenceItem> evidence = new ArrayList<>(List.of(
                    item("e1", "reuters", 0.8), item("e2", "bloomberg", 0.75), item("e3", "wsj", 0.9)));
            double before = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            evidence.add(against("e4", "blog", 0.7));
            double after = aggregator.aggregate("c-1", evidence, List.of(), NOW).posterior();

            assertTrue(after < before, "posterior should fall from " + before + " but was " + after);
        }
    }

    @Nested
    @DisplayName("Dependency detection failures")
    @ExtendWith(MockitoExtension.class)
    class DetectorFailureTests {

        @Mock
        DependencyDetector detector;

        @Test
        @DisplayName("Failing detector degrades to independence and lowers trust")
        void degradesToIndependence() {
            when(detector.detect(anyList(), anyList()))
                    .thenThrow(new DependencyDetectionException("index unavailable", Provenance.empty()));
            BayesianAggregator degraded = new BayesianAggregator(AggregationOptions.defaults(), detector);
            List<EvidenceItem> evidence = List.of(
                    item("e1", "a", 0.8), item("e2", "b", 0.75), item("e3", "c", 0.9), item("e4", "d", 0.6));

            AuditTrail trail = degraded.aggregate("c-1", evidence, List.of(), NOW);
            AuditTrail closedForm = new BayesianAggregator(AggregationOptions.builder()
                    .closedFormMaxItems(10).build()).aggregate("c-1", evidence, List.of(), NOW);

            assertTrue(trail.lowerTrust());
            assertEquals(1, trail.warnings().size());
            assertTrue(trail.warnings().get(0).contains("index unavailable"));
            assertEquals(closedForm.posterior(), trail.posterior(), 1e-12);
        }

        @Test
        @DisplayName("Detector is skipped for small evidence sets with nothing suggesting dependence")
        void detectorSkippedForClosedForm() {
            BayesianAggregator withMock = new BayesianAggregator(AggregationOptions.defaults(), detector);

            withMock.aggregate("c-1", List.of(item("e1", "a", 0.8), item("e2", "b", 0.7)), List.of(), NOW);

            verifyNoInteractions(detector);
        }

        @Test
        @DisplayName("Detector runs when two items share a source")
        void detectorRunsOnSharedSource() {
            when(detector.detect(anyList(), anyList())).thenReturn(List.of());
            BayesianAggregator withMock = new BayesianAggregator(AggregationOptions.defaults(), detector);

            AuditTrail trail = withMock.aggregate("c-1",
                    List.of(item("e1", "a", 0.8), item("e2", "a", 0.7)), List.of(), NOW);

            verify(detector).detect(anyList(), anyList());
            assertTrue(trail.isClustered());
        }
    }

    @Test
    @DisplayName("Logit and sigmoid are inverse")
    void logitSigmoidInverse() {
        for (double p : new double[]{0.01, 0.3, 0.5, 0.77, 0.999}) {
            assertEquals(p, BayesianAggregator.sigmoid(BayesianAggregator.logit(p)), 1e-12);
        }
    }
}
