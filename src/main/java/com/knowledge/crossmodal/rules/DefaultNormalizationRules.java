package com.knowledge.crossmodal.rules;

import java.util.List;

/**
 * Built-in normalization rules for person and organization mentions.
 */
public final class DefaultNormalizationRules {

    public static final String[] PERSON_TYPES = {"PERSON"};
    public static final String[] ORGANIZATION_TYPES = {"ORG", "ORGANIZATION", "COMPANY"};

    private DefaultNormalizationRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getPersonRules());
        engine.addRules(getOrganizationRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^(Mr|Mrs|Ms|Dr|Prof|Sir|Dame)\\.?\\s+")
                        .typeLabels(PERSON_TYPES)
                        .priority(10)
                        .build(),
                // "T. Cook, CEO" / "Jane Doe, Chief Executive Officer of X"
                NormalizationRule.builder()
                        .name("person-role-suffix")
                        .pattern(",\\s*(CEO|CFO|CTO|COO|Chair(man|woman|person)?|President|Founder|Director"
                                + "|Chief [A-Za-z ]+ Officer)\\b.*$")
                        .typeLabels(PERSON_TYPES)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .pattern(",?\\s+(Jr|Sr|II|III|IV)\\.?$")
                        .typeLabels(PERSON_TYPES)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getOrganizationRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("org-legal-suffix")
                        .pattern(",?\\s+(Inc|Incorporated|Corp|Corporation|Co|Company|Ltd|Limited|LLC|L\\.L\\.C"
                                + "|PLC|GmbH|AG|S\\.?A|N\\.?V|B\\.?V)\\.?$")
                        .typeLabels(ORGANIZATION_TYPES)
                        .priority(10)
                        .build(),
                NormalizationRule.builder()
                        .name("org-leading-article")
                        .pattern("^The\\s+")
                        .typeLabels(ORGANIZATION_TYPES)
                        .priority(20)
                        .build()
        );
    }

    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" and ")
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("common-punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build()
        );
    }
}
