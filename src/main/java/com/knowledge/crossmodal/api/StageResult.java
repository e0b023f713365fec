package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.error.KnowledgeException;

import java.util.List;

/**
 * Per-item results of one ingestion stage and the typed errors of the items that failed.
 * A failing item never stops the remaining items.
 */
public record StageResult<T>(List<T> results, List<KnowledgeException> failures) {

    public StageResult {
        results = results != null ? List.copyOf(results) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public static <T> StageResult<T> empty() {
        return new StageResult<>(List.of(), List.of());
    }
}
