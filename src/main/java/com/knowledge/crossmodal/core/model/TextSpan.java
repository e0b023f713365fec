package com.knowledge.crossmodal.core.model;

/**
 * Character offsets of a mention inside its source document, end exclusive.
 */
public record TextSpan(int start, int end) {
    public TextSpan {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (end <= start) {
            throw new IllegalArgumentException("end must be > start");
        }
    }

    public int length() {
        return end - start;
    }
}
