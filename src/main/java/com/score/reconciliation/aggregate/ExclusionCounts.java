package com.score.reconciliation.aggregate;

/**
 * Per-reason tally of records seen by the aggregator.
 *
 * @param accepted       records that contributed a score
 * @param invalid        records flagged invalid themselves
 * @param mergeVotes     records carrying a superseded-by annotation
 * @param blankId        records without an identifier
 * @param missingScore   records without a score
 * @param malformedScore records whose score is not a finite number
 * @param invalidGroup   records whose canonical group contains an invalid member
 */
public record ExclusionCounts(
        long accepted,
        long invalid,
        long mergeVotes,
        long blankId,
        long missingScore,
        long malformedScore,
        long invalidGroup
) {
    public static final ExclusionCounts NONE = new ExclusionCounts(0, 0, 0, 0, 0, 0, 0);

    public long excluded() {
        return invalid + mergeVotes + blankId + missingScore + malformedScore + invalidGroup;
    }

    public long total() {
        return accepted + excluded();
    }

    @Override
    public String toString() {
        return "ExclusionCounts{accepted=" + accepted +
                ", invalid=" + invalid +
                ", mergeVotes=" + mergeVotes +
                ", blankId=" + blankId +
                ", missingScore=" + missingScore +
                ", malformedScore=" + malformedScore +
                ", invalidGroup=" + invalidGroup + '}';
    }
}
