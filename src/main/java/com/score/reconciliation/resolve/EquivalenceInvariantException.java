package com.score.reconciliation.resolve;

/**
 * Runtime exception thrown when the resolver's internal bookkeeping is
 * inconsistent, for example a canonical identifier outside its own group.
 * Indicates a defect, never a data-quality problem.
 */
public class EquivalenceInvariantException extends IllegalStateException {

    public EquivalenceInvariantException(String message) {
        super(message);
    }
}
