package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.DependencyDeclaration;
import com.knowledge.crossmodal.core.model.EvidenceItem;
import com.knowledge.crossmodal.error.DependencyDetectionException;
import com.knowledge.crossmodal.error.InsufficientEvidenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Combines evidence in log-odds space.
 *
 * <p>Each item contributes {@code logit(c)} towards its stance, with {@code c} clamped away
 * from 0 and 1. Small evidence sets with nothing suggesting dependence are summed directly.
 * Otherwise the dependency detector links dependent items and linked items pulling the same way
 * form a cluster. In a cluster with dependency strength {@code s} the strongest item counts fully
 * and the others by {@code 1 - s}, so fully redundant items count as one voice. Adding an item
 * never moves the posterior against the item's own stance unless its links raise the dependency
 * strength among items already present.</p>
 *
 * <p>Evidence and clusters are always processed in ascending evidence-id order, which makes
 * the floating point result independent of submission order.</p>
 */
public class BayesianAggregator {
    private static final Logger log = LoggerFactory.getLogger(BayesianAggregator.class);

    private final AggregationOptions options;
    private final DependencyDetector detector;

    public BayesianAggregator() {
        this(AggregationOptions.defaults());
    }

    public BayesianAggregator(AggregationOptions options) {
        this(options, new HeuristicDependencyDetector(options));
    }

    public BayesianAggregator(AggregationOptions options, DependencyDetector detector) {
        this.options = options;
        this.detector = detector;
    }

    /**
     * @throws InsufficientEvidenceException if the evidence list is empty
     */
    public AuditTrail aggregate(String claimId, List<EvidenceItem> evidence,
                                List<DependencyDeclaration> declarations, Instant computedAt) {
        if (evidence.isEmpty()) {
            throw new InsufficientEvidenceException(claimId, "No evidence to aggregate for claim " + claimId);
        }
        List<EvidenceItem> ordered = new ArrayList<>(evidence);
        ordered.sort(Comparator.comparing(EvidenceItem::evidenceId));

        if (ordered.size() <= options.getClosedFormMaxItems() && !suspectsDependence(ordered, declarations)) {
            return combine(claimId, ordered, List.of(), AuditTrail.METHOD_CLOSED_FORM, false, List.of(), computedAt);
        }

        List<DependencyLink> links;
        boolean lowerTrust = false;
        List<String> warnings = new ArrayList<>();
        try {
            links = detector.detect(ordered, declarations);
        } catch (DependencyDetectionException e) {
            log.warn("aggregation.dependency.degraded claimId={} evidence={} error={}",
                    claimId, ordered.size(), e.getMessage(), e);
            links = List.of();
            lowerTrust = true;
            warnings.add("Dependency detection failed (" + e.getMessage() + "); evidence treated as independent");
        }
        return combine(claimId, ordered, links, AuditTrail.METHOD_CLUSTERED, lowerTrust, warnings, computedAt);
    }

    /**
     * Cheap pre-check: declared groups, shared tags, shared sources or any citations at all.
     */
    boolean suspectsDependence(List<EvidenceItem> evidence, List<DependencyDeclaration> declarations) {
        if (!declarations.isEmpty()) {
            return true;
        }
        Set<String> tags = new HashSet<>();
        Set<String> sources = new HashSet<>();
        for (EvidenceItem item : evidence) {
            if (!item.citations().isEmpty()) {
                return true;
            }
            if (item.dependencyTag() != null && !tags.add(item.dependencyTag())) {
                return true;
            }
            if (!sources.add(item.sourceId())) {
                return true;
            }
        }
        return false;
    }

    private AuditTrail combine(String claimId, List<EvidenceItem> ordered, List<DependencyLink> links,
                               String method, boolean lowerTrust, List<String> warnings, Instant computedAt) {
        double priorLogOdds = logit(options.getPrior());
        Map<String, Double> logOdds = new HashMap<>();
        for (EvidenceItem item : ordered) {
            double l = logit(clamp(item.confidence()));
            logOdds.put(item.evidenceId(), item.supports() ? l : -l);
        }

        // Only links between items pulling the same way cluster them; a contradiction never joins a support group.
        UnionFind clusters = new UnionFind();
        ordered.forEach(item -> clusters.add(item.evidenceId()));
        for (DependencyLink link : links) {
            if (sameDirection(logOdds, link.firstEvidenceId(), link.secondEvidenceId())) {
                clusters.union(link.firstEvidenceId(), link.secondEvidenceId());
            }
        }

        // The root of each group is its smallest member id, so groups iterate in evidence-id order.
        TreeMap<String, List<String>> groups = new TreeMap<>();
        for (EvidenceItem item : ordered) {
            groups.computeIfAbsent(clusters.find(item.evidenceId()), k -> new ArrayList<>()).add(item.evidenceId());
        }

        List<EvidenceCluster> result = new ArrayList<>();
        List<Double> running = new ArrayList<>();
        double total = priorLogOdds;
        for (List<String> members : groups.values()) {
            Set<String> memberSet = new HashSet<>(members);
            double strength = 0.0;
            for (DependencyLink link : links) {
                if (memberSet.contains(link.firstEvidenceId()) && memberSet.contains(link.secondEvidenceId())) {
                    strength = Math.max(strength, link.strength());
                }
            }
            double rawLogOdds = 0.0;
            for (String id : members) {
                rawLogOdds += logOdds.get(id);
            }
            double discounted = discount(members, logOdds, strength);
            result.add(new EvidenceCluster(members, strength, rawLogOdds, discounted,
                    sigmoid(priorLogOdds + discounted)));
            total += discounted;
            running.add(sigmoid(total));
        }

        double posterior = sigmoid(total);
        List<DependencyLink> sortedLinks = new ArrayList<>(links);
        sortedLinks.sort(Comparator.comparing(DependencyLink::firstEvidenceId)
                .thenComparing(DependencyLink::secondEvidenceId)
                .thenComparing(DependencyLink::kind));
        return new AuditTrail(claimId, ordered, sortedLinks, result, running, options.getPrior(), posterior,
                method, AuditTrail.METHOD_VERSION, lowerTrust, warnings, computedAt);
    }

    /**
     * The strongest member counts fully and every other member by {@code 1 - strength}.
     * All members pull the same way, so adding one can only move the cluster further in its direction.
     */
    static double discount(List<String> members, Map<String, Double> logOdds, double strength) {
        double strongest = 0.0;
        double rest = 0.0;
        for (String id : members) {
            double magnitude = Math.abs(logOdds.get(id));
            if (magnitude > strongest) {
                rest += strongest;
                strongest = magnitude;
            } else {
                rest += magnitude;
            }
        }
        double magnitude = strongest + (1.0 - strength) * rest;
        return direction(logOdds.get(members.get(0))) < 0 ? -magnitude : magnitude;
    }

    private static boolean sameDirection(Map<String, Double> logOdds, String a, String b) {
        Double la = logOdds.get(a);
        Double lb = logOdds.get(b);
        return la != null && lb != null && direction(la) == direction(lb);
    }

    private static int direction(double logOdds) {
        return logOdds < 0 ? -1 : 1;
    }

    double clamp(double confidence) {
        return Math.max(options.getClampMin(), Math.min(options.getClampMax(), confidence));
    }

    static double logit(double p) {
        return Math.log(p / (1.0 - p));
    }

    static double sigmoid(double x) {
        return 1.0 / (1.0 + Math.exp(-x));
    }

    public AggregationOptions getOptions() {
        return options;
    }

    public DependencyDetector getDetector() {
        return detector;
    }

    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();

        void add(String id) {
            parent.putIfAbsent(id, id);
        }

        String find(String id) {
            String root = id;
            while (!parent.get(root).equals(root)) {
                root = parent.get(root);
            }
            String current = id;
            while (!current.equals(root)) {
                String next = parent.get(current);
                parent.put(current, root);
                current = next;
            }
            return root;
        }

        void union(String a, String b) {
            if (!parent.containsKey(a) || !parent.containsKey(b)) {
                return;
            }
            String ra = find(a);
            String rb = find(b);
            if (!ra.equals(rb)) {
                // smaller id becomes the root
                if (ra.compareTo(rb) < 0) {
                    parent.put(rb, ra);
                } else {
                    parent.put(ra, rb);
                }
            }
        }
    }
}
