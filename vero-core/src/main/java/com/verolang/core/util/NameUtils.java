package com.verolang.core.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming conventions and "did you mean" lookups.
 */
public final class NameUtils {

    private static final Pattern PASCAL_CASE = Pattern.compile("[A-Z][a-zA-Z0-9]*");
    private static final Pattern CAMEL_CASE = Pattern.compile("[a-z][a-zA-Z0-9]*");
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^a-zA-Z0-9]+");

    /** Largest edit distance still offered as a suggestion. */
    private static final int MAX_SUGGESTION_DISTANCE = 3;
    private static final int MAX_SUGGESTIONS = 3;

    private NameUtils() {
        // Utility class
    }

    public static boolean isPascalCase(String name) {
        return PASCAL_CASE.matcher(name).matches();
    }

    public static boolean isCamelCase(String name) {
        return CAMEL_CASE.matcher(name).matches();
    }

    /**
     * {@code login_page} and {@code loginPage} both become {@code LoginPage}.
     */
    public static String toPascalCase(String name) {
        String camel = toCamelCase(name);
        return camel.isEmpty() ? camel : Character.toUpperCase(camel.charAt(0)) + camel.substring(1);
    }

    /**
     * {@code Submit_Button} and {@code SubmitButton} both become {@code submitButton}.
     */
    public static String toCamelCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String word : WORD_SEPARATOR.split(name)) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() == 0) {
                sb.append(Character.toLowerCase(word.charAt(0))).append(word.substring(1));
            } else {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.toString();
    }

    /**
     * Candidates within a small edit distance of {@code name}, closest first. Comparison
     * ignores case.
     *
     * @param name misspelled name
     * @param candidates known names
     * @return up to three suggestions
     */
    public static List<String> findSimilar(String name, Collection<String> candidates) {
        record Scored(String candidate, int distance) {}

        String target = name.toLowerCase(Locale.ROOT);
        int threshold = Math.min(MAX_SUGGESTION_DISTANCE, Math.max(1, target.length() / 2));
        List<Scored> scored = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate.equals(name)) {
                continue;
            }
            int distance = levenshtein(target, candidate.toLowerCase(Locale.ROOT));
            if (distance <= threshold) {
                scored.add(new Scored(candidate, distance));
            }
        }
        return scored.stream()
            .sorted(Comparator.comparingInt(Scored::distance).thenComparing(Scored::candidate))
            .map(Scored::candidate)
            .distinct()
            .limit(MAX_SUGGESTIONS)
            .toList();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
