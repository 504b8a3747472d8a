package com.viffx.ShiftReduce.Parser;

/**
 * Thrown when a search expands more configurations than its ceiling allows. The derivations
 * reported before the ceiling was hit were delivered to the listener already.
 */
public class SearchLimitExceededException extends RuntimeException {
    private final long expansions;
    private final int derivationsFound;

    public SearchLimitExceededException(long limit, long expansions, int derivationsFound) {
        super("Search stopped after " + expansions + " expansions (limit " + limit + "), "
                + derivationsFound + " derivations found so far");
        this.expansions = expansions;
        this.derivationsFound = derivationsFound;
    }

    public long expansions() {
        return expansions;
    }

    public int derivationsFound() {
        return derivationsFound;
    }
}
