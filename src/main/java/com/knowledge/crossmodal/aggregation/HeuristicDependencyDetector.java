package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.error.DependencyDetectionException;
import com.knowledge.crossmodal.error.Provenance;
import com.knowledge.crossmodal.similarity.JaccardSimilarity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pairwise heuristics over evidence metadata:
 * <ul>
 *   <li>operator-declared groups (strength 1)</li>
 *   <li>shared dependency tag (strength 1)</li>
 *   <li>shared source (strength 1)</li>
 *   <li>citation overlap at or above the configured Jaccard threshold (strength = overlap)</li>
 *   <li>temporal cascade: same stance, within the cascade window, one cites the other's source</li>
 * </ul>
 */
public class HeuristicDependencyDetector implements DependencyDetector {

    private final AggregationOptions options;

    public HeuristicDependencyDetector() {
        this(AggregationOptions.defaults());
    }

    public HeuristicDependencyDetector(AggregationOptions options) {
        this.options = options;
    }

    @Override
    public List<DependencyLink> detect(List<EvidenceItem> evidence, List<DependencyDeclaration> declarations) {
        Set<String> known = new HashSet<>();
        for (EvidenceItem item : evidence) {
            if (!known.add(item.evidenceId())) {
                throw new DependencyDetectionException("Duplicate evidence id " + item.evidenceId(),
                        Provenance.builder().evidence(item.evidenceId()).source(item.sourceId()).build());
            }
        }

        List<DependencyLink> links = new ArrayList<>();
        for (DependencyDeclaration declaration : declarations) {
            List<String> members = new ArrayList<>(new TreeSet<>(declaration.evidenceIds()));
            for (String id : members) {
                if (!known.contains(id)) {
                    throw new DependencyDetectionException(
                            "Declared dependency references unknown evidence " + id,
                            Provenance.builder().evidence(declaration.evidenceIds()).build());
                }
            }
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    links.add(DependencyLink.of(members.get(i), members.get(j), DependencyKind.DECLARED, 1.0));
                }
            }
        }

        for (int i = 0; i < evidence.size(); i++) {
            for (int j = i + 1; j < evidence.size(); j++) {
                pairLinks(evidence.get(i), evidence.get(j), links);
            }
        }
        return links;
    }

    private void pairLinks(EvidenceItem a, EvidenceItem b, List<DependencyLink> links) {
        String ida = a.evidenceId();
        String idb = b.evidenceId();
        if (a.dependencyTag() != null && a.dependencyTag().equals(b.dependencyTag())) {
            links.add(DependencyLink.of(ida, idb, DependencyKind.SHARED_TAG, 1.0));
        }
        if (a.sourceId().equals(b.sourceId())) {
            links.add(DependencyLink.of(ida, idb, DependencyKind.SHARED_SOURCE, 1.0));
        }
        if (!a.citations().isEmpty() && !b.citations().isEmpty()) {
            double overlap = JaccardSimilarity.of(a.citations(), b.citations());
            if (overlap > 0.0 && overlap >= options.getCitationOverlapThreshold()) {
                links.add(DependencyLink.of(ida, idb, DependencyKind.CITATION_OVERLAP, overlap));
            }
        }
        if (isCascade(a, b)) {
            links.add(DependencyLink.of(ida, idb, DependencyKind.TEMPORAL_CASCADE, options.getCascadeStrength()));
        }
    }

    private boolean isCascade(EvidenceItem a, EvidenceItem b) {
        if (a.stance() != b.stance() || a.observedAt() == null || b.observedAt() == null) {
            return false;
        }
        Duration gap = Duration.between(a.observedAt(), b.observedAt()).abs();
        if (gap.compareTo(options.getCascadeWindow()) > 0) {
            return false;
        }
        return a.citations().contains(b.sourceId()) || b.citations().contains(a.sourceId());
    }
}
