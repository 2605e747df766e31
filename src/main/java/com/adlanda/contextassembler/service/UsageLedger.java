package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.model.TokenSource;
import com.adlanda.contextassembler.model.UsageRecord;
import com.adlanda.contextassembler.model.UsageRecord.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only token and latency accounting for one assembly run.
 *
 * Every remote call attempt and every file load appends a record. The ledger is finalized
 * exactly once, which appends a grand-total row; later appends are rejected.
 * Appends are serialized so records keep a total order.
 */
public class UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    public static final String TOTAL_OPERATION = "TOTAL";

    private final TokenSource sessionSource;
    private final Clock clock;
    private final List<UsageRecord> records = new ArrayList<>();

    private long totalInputTokens;
    private long totalOutputTokens;
    private boolean mixedSources;
    private boolean finalized;

    public UsageLedger(TokenSource sessionSource) {
        this(sessionSource, Clock.systemUTC());
    }

    public UsageLedger(TokenSource sessionSource, Clock clock) {
        this.sessionSource = sessionSource;
        this.clock = clock;
    }

    /**
     * Appends a record stamped with the ledger's clock.
     *
     * @throws IllegalStateException if the ledger was already finalized
     */
    public synchronized UsageRecord append(String operation, long inputTokens, long outputTokens,
                                           int attempt, Outcome outcome, Duration latency,
                                           TokenSource tokenSource) {
        if (finalized) {
            throw new IllegalStateException("Usage ledger already finalized, cannot record " + operation);
        }
        if (outcome == Outcome.TOTAL) {
            throw new IllegalArgumentException("TOTAL rows are written by finalizeLedger()");
        }
        if (tokenSource != sessionSource && !mixedSources) {
            mixedSources = true;
            log.warn("Token source {} recorded for '{}' in a {} session; totals mix exact and estimated counts",
                    tokenSource, operation, sessionSource);
        }
        UsageRecord record = new UsageRecord(operation, inputTokens, outputTokens, clock.instant(),
                attempt, outcome, latency, tokenSource);
        records.add(record);
        totalInputTokens += inputTokens;
        totalOutputTokens += outputTokens;
        return record;
    }

    /**
     * Writes the grand-total row. Can be called only once.
     */
    public synchronized UsageRecord finalizeLedger() {
        if (finalized) {
            throw new IllegalStateException("Usage ledger already finalized");
        }
        Duration totalLatency = records.stream()
                .map(UsageRecord::latency)
                .reduce(Duration.ZERO, Duration::plus);
        UsageRecord total = new UsageRecord(TOTAL_OPERATION, totalInputTokens, totalOutputTokens,
                clock.instant(), 0, Outcome.TOTAL, totalLatency, sessionSource);
        records.add(total);
        finalized = true;
        log.info("Usage totals: {} input tokens, {} output tokens over {} records ({}{})",
                totalInputTokens, totalOutputTokens, records.size() - 1, sessionSource,
                mixedSources ? ", mixed sources" : "");
        return total;
    }

    public synchronized List<UsageRecord> records() {
        return List.copyOf(records);
    }

    /**
     * Records whose operation equals the given name, in append order.
     */
    public synchronized List<UsageRecord> recordsFor(String operation) {
        return records.stream()
                .filter(r -> r.operation().equals(operation))
                .toList();
    }

    public synchronized long totalInputTokens() {
        return totalInputTokens;
    }

    public synchronized long totalOutputTokens() {
        return totalOutputTokens;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    public synchronized boolean hasMixedSources() {
        return mixedSources;
    }

    public TokenSource sessionSource() {
        return sessionSource;
    }
}
