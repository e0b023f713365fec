package com.knowledge.crossmodal.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Keys on the type label plus:
 * <ul>
 *   <li>the last token ({@code last:PERSON|cook}), shared by "tim cook" and "t cook"</li>
 *   <li>a three-character prefix of the first token ({@code pfx:PERSON|tim}), catching typos in the last token</li>
 * </ul>
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    @Override
    public Set<String> generateKeys(String normalizedText, String typeLabel) {
        Set<String> keys = new LinkedHashSet<>();
        if (normalizedText == null || normalizedText.isBlank()) {
            return keys;
        }
        String type = typeLabel == null || typeLabel.isBlank() ? "UNKNOWN" : typeLabel.trim().toUpperCase(Locale.ROOT);
        String[] tokens = normalizedText.strip().split("\\s+");
        keys.add("last:" + type + "|" + tokens[tokens.length - 1]);
        String first = tokens[0];
        if (first.length() >= 3) {
            keys.add("pfx:" + type + "|" + first.substring(0, 3));
        }
        return keys;
    }
}
