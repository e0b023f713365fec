package com.knowledge.crossmodal.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Applies normalization rules to surface forms in priority order
 * (lower number first), then lowercases, trims and collapses whitespace.
 * Safe for concurrent use; rule changes only affect later calls.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final CopyOnWriteArrayList<NormalizationRule> rules = new CopyOnWriteArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public synchronized void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        merged.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        rules.clear();
        rules.addAll(merged);
    }

    public synchronized boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String normalize(String surfaceText) {
        return normalize(surfaceText, null);
    }

    public String normalize(String surfaceText, String typeLabel) {
        if (surfaceText == null || surfaceText.isBlank()) {
            return "";
        }
        String result = surfaceText.strip();
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(typeLabel)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("normalize.rule name={} before='{}' after='{}'", rule.getName(), before, result);
                }
            }
        }
        return result.toLowerCase(Locale.ROOT).strip().replaceAll("\\s+", " ");
    }

    public boolean areEquivalent(String a, String b, String typeLabel) {
        return normalize(a, typeLabel).equals(normalize(b, typeLabel));
    }
}
