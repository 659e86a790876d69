package com.verolang.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.verolang.core.error.ErrorSuggestion;
import com.verolang.core.error.VeroError;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prints diagnostics for the {@code check} and {@code compile} commands.
 */
final class DiagnosticPrinter {

    static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private DiagnosticPrinter() {
        // Utility class
    }

    /**
     * One block per diagnostic, prefixed with the file.
     */
    static void printText(PrintWriter out, String file, List<VeroError> diagnostics) {
        for (VeroError error : diagnostics) {
            out.println(file + ": " + error.severity().name().toLowerCase(Locale.ROOT) + " " + error.toShortMessage());
            if (!error.howToFix().isBlank()) {
                out.println("    " + error.howToFix());
            }
            for (ErrorSuggestion suggestion : error.suggestions()) {
                out.println("    " + suggestion.text());
            }
        }
    }

    /**
     * Diagnostics grouped by file, as JSON.
     */
    static void printJson(PrintWriter out, Map<String, List<VeroError>> byFile) {
        out.println(toJson(new LinkedHashMap<>(byFile)));
    }

    static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
