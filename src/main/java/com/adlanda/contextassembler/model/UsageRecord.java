package com.adlanda.contextassembler.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One row of the usage ledger.
 *
 * @param operation    What was done ("select-files", "load:src/Main.java", "TOTAL", ...)
 * @param inputTokens  Tokens sent, or file tokens for a load
 * @param outputTokens Tokens received
 * @param timestamp    When the record was written
 * @param attempt      Attempt number within one logical remote call, 0 for non-remote records
 * @param outcome      Result of the operation
 * @param latency      Elapsed time of the attempt
 * @param tokenSource  How the token counts were obtained
 */
public record UsageRecord(
        String operation,
        long inputTokens,
        long outputTokens,
        Instant timestamp,
        int attempt,
        Outcome outcome,
        Duration latency,
        TokenSource tokenSource
) {
    public enum Outcome {
        SUCCEEDED,
        RATE_LIMITED,
        FAILED,
        LOADED,
        SKIPPED,
        TOTAL
    }

    public boolean isSuccessful() {
        return outcome == Outcome.SUCCEEDED;
    }
}
