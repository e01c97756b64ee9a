package com.score.reconciliation.aggregate;

/**
 * Outcome of parsing a raw score cell.
 *
 * @param status outcome of the parse
 * @param value  parsed value, meaningful only when {@link Status#PARSED}
 * @param raw    the text that was parsed
 */
public record ScoreParseResult(Status status, double value, String raw) {

    public enum Status {
        PARSED,
        MISSING,
        MALFORMED
    }

    public static ScoreParseResult parsed(double value, String raw) {
        return new ScoreParseResult(Status.PARSED, value, raw);
    }

    public static ScoreParseResult missing() {
        return new ScoreParseResult(Status.MISSING, Double.NaN, null);
    }

    public static ScoreParseResult malformed(String raw) {
        return new ScoreParseResult(Status.MALFORMED, Double.NaN, raw);
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }
}
