package com.verolang.core.transpiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Literal and identifier helpers for the generated TypeScript.
 */
final class TypeScript {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Set<String> TAKEN_NAMES = Set.of("Page", "Locator", "test", "expect", "page", "browser");

    private TypeScript() {
        // Utility class
    }

    /**
     * Single-quoted string literal.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * Object literal for a combination's bindings, written as JSON.
     */
    static String objectLiteral(Map<String, Object> values) {
        try {
            return JSON.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Combination values are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Property access that stays valid for keys that are not identifiers, such as data columns
     * with spaces.
     */
    static String property(String target, String key) {
        return target + "[" + quote(key) + "]";
    }

    /**
     * Dotted member access when {@code name} is a plain identifier, bracket access otherwise.
     */
    static String member(String target, String name) {
        return IDENTIFIER.matcher(name).matches() ? target + "." + name : property(target, name);
    }

    /**
     * Class name for a page or library; names that clash with Playwright imports get a suffix.
     */
    static String className(String name) {
        return TAKEN_NAMES.contains(name) ? name + "_" : name;
    }

    /**
     * Name of the local holding an instance of a page class: {@code LoginPage} becomes
     * {@code loginPage}.
     */
    static String instanceName(String className) {
        String name = className(className);
        String local = Character.toLowerCase(name.charAt(0)) + name.substring(1);
        return TAKEN_NAMES.contains(local) ? local + "_" : local;
    }
}
