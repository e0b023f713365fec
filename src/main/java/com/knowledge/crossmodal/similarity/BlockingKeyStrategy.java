package com.knowledge.crossmodal.similarity;

import java.util.Set;

/**
 * Generates blocking keys for a normalized surface form. Entities sharing at least one
 * key with a mention are its candidates; keys also name the locks resolution takes,
 * so two mentions that could land on the same entity must share a key.
 */
public interface BlockingKeyStrategy {

    /**
     * @return blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String normalizedText, String typeLabel);
}
