package com.adlanda.contextassembler.exception;

/**
 * A selection strategy could not produce a usable ranking.
 *
 * The pipeline recovers by moving on to the next strategy in its fallback chain.
 */
public class SelectionFailureException extends AssemblerException {

    private final String strategy;

    public SelectionFailureException(String strategy, String message) {
        super(strategy + ": " + message);
        this.strategy = strategy;
    }

    public SelectionFailureException(String strategy, String message, Throwable cause) {
        super(strategy + ": " + message, cause);
        this.strategy = strategy;
    }

    public String getStrategy() {
        return strategy;
    }
}
