package com.knowledge.crossmodal.tracing;

/**
 * Operations the engine traces, with their span names.
 */
public enum TraceOperation {
    RESOLVE("knowledge.resolve"),
    MERGE("knowledge.merge"),
    SPLIT("knowledge.split"),
    COMMIT("knowledge.commit"),
    AGGREGATE("knowledge.aggregate");

    private final String spanName;

    TraceOperation(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}
