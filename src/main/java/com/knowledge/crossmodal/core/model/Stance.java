package com.knowledge.crossmodal.core.model;

import java.util.Locale;

/**
 * Whether an evidence item asserts or denies its claim.
 */
public enum Stance {
    SUPPORTS,
    CONTRADICTS;

    public static Stance fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return SUPPORTS;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "supports", "support", "corroborates" -> SUPPORTS;
            case "contradicts", "contradict", "refutes" -> CONTRADICTS;
            default -> throw new IllegalArgumentException("Unknown stance: " + label);
        };
    }
}
