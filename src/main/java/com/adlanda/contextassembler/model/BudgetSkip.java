package com.adlanda.contextassembler.model;

/**
 * A ranked candidate that the token budget loader left out.
 *
 * @param path            Project-relative path
 * @param estimatedTokens Token estimate of the file (0 when it could not be read)
 * @param remainingBudget Budget left at the moment the file was skipped
 * @param reason          Why the file was left out
 */
public record BudgetSkip(String path, long estimatedTokens, long remainingBudget, Reason reason) {

    public enum Reason {
        OVER_BUDGET,
        UNREADABLE
    }
}
