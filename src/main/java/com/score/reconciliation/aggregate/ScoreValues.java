package com.score.reconciliation.aggregate;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsing helpers for the text cells that producers hand over untouched:
 * scores, boolean flags and merge annotations.
 */
public final class ScoreValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Set<String> TRUE_FLAGS = Set.of("1", "true", "yes", "y");
    private static final Set<String> EMPTY_ANNOTATIONS = Set.of("nan", "none");

    private ScoreValues() {
    }

    /**
     * Parses a score cell. Blank input is {@code MISSING}; anything that is not a
     * finite decimal number is {@code MALFORMED}.
     */
    public static ScoreParseResult parseScore(String raw) {
        if (raw == null) {
            return ScoreParseResult.missing();
        }
        String text = raw.strip();
        if (text.isEmpty()) {
            return ScoreParseResult.missing();
        }
        if (!DECIMAL.matcher(text).matches()) {
            return ScoreParseResult.malformed(raw);
        }
        double value = Double.parseDouble(text);
        if (!Double.isFinite(value)) {
            return ScoreParseResult.malformed(raw);
        }
        return ScoreParseResult.parsed(value, raw);
    }

    /**
     * Reads a flag cell: {@code 1}, {@code true}, {@code yes} and {@code y}
     * (any case, surrounding whitespace ignored) are true, everything else false.
     */
    public static boolean parseFlag(String raw) {
        if (raw == null) {
            return false;
        }
        return TRUE_FLAGS.contains(raw.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Cleans a "superseded-by" annotation. Returns null for blank input and for
     * the placeholders {@code nan} and {@code none}.
     */
    public static String normalizeAnnotation(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.strip();
        if (text.isEmpty() || EMPTY_ANNOTATIONS.contains(text.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return text;
    }
}
