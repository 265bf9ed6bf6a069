package org.satisfier.dpll;

import org.satisfier.SatisfierException;

/**
 * Superato il budget di decisioni configurato sul {@link DPLLSolver}.
 */
public class SearchLimitExceededException extends SatisfierException {

    private final int limit;

    public SearchLimitExceededException(int limit) {
        super("Superato il limite di " + limit + " decisioni");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
