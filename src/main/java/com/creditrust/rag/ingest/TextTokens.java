package com.creditrust.rag.ingest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical normalisation shared by the local embedding model and the
 * attribution checks: lower-cased word tokens of at least three characters,
 * common English function words removed and a trailing plural {@code s}
 * stripped.
 */
public final class TextTokens {

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "are", "was", "were", "why", "what", "when", "where", "who", "how", "which",
            "this", "that", "these", "those", "with", "from", "into", "onto", "about", "have", "has", "had",
            "not", "but", "you", "your", "they", "them", "their", "our", "its", "his", "her", "she", "him",
            "can", "could", "would", "should", "will", "did", "does", "been", "being", "there", "then",
            "than", "also", "any", "all", "some", "out", "too", "very", "just", "over", "under", "because");

    private TextTokens() {
    }

    public static List<String> tokenize(String value) {
        String normalized = value == null ? "" : value.toLowerCase(Locale.ROOT);
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split("[^\\p{L}\\p{N}]+")) {
            if (token.length() >= 3 && !STOP_WORDS.contains(token)) {
                tokens.add(stem(token));
            }
        }
        return tokens;
    }

    public static Set<String> distinct(String value) {
        return new LinkedHashSet<>(tokenize(value));
    }

    private static String stem(String token) {
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
