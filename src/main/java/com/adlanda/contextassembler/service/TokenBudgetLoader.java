package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.model.AssembledContext;
import com.adlanda.contextassembler.model.BudgetSkip;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import com.adlanda.contextassembler.model.TokenEstimate;
import com.adlanda.contextassembler.model.UsageRecord.Outcome;
import com.adlanda.contextassembler.service.selection.SelectionContext;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills a token budget with whole files, in ranking order.
 *
 * A file is admitted only if it still fits under {@code tokenLimit * (1 - bufferFraction)};
 * a file that does not fit is skipped and the next one is tried. Files are never truncated
 * and candidates are never reordered.
 */
@Service
public class TokenBudgetLoader {

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetLoader.class);

    /** Token limit that admits every readable candidate. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    static final String LOAD_OPERATION = "load:";

    private final TokenCounter tokenCounter;
    private final double bufferFraction;

    @Autowired
    public TokenBudgetLoader(TokenCounter tokenCounter, AssemblyProperties properties) {
        this(tokenCounter, properties.getBufferFraction());
    }

    public TokenBudgetLoader(TokenCounter tokenCounter, double bufferFraction) {
        if (bufferFraction < 0.0 || bufferFraction >= 1.0) {
            throw new IllegalArgumentException("Buffer fraction must be in [0, 1), was " + bufferFraction);
        }
        this.tokenCounter = tokenCounter;
        this.bufferFraction = bufferFraction;
    }

    /**
     * Loads the ranked files that fit the budget.
     *
     * @param ranking    Candidates, best first
     * @param tokenLimit Hard token ceiling, or {@link #UNLIMITED}
     * @param fileTree   Tree the ranking was built from
     * @param context    README, content reader and ledger of the run
     */
    public AssembledContext load(CandidateRanking ranking, long tokenLimit, FileTree fileTree, SelectionContext context) {
        long budget = effectiveBudget(tokenLimit);
        log.info("Loading up to {} ranked files within {} tokens (limit {}, buffer {})",
                ranking.size(), budget, tokenLimit, bufferFraction);

        Map<String, String> contents = new LinkedHashMap<>();
        List<BudgetSkip> skipped = new ArrayList<>();
        long totalTokens = 0;

        for (RankedFile candidate : ranking.files()) {
            String path = candidate.path();
            long start = System.nanoTime();

            String content;
            try {
                content = context.contentReader().read(path);
            } catch (IOException | RuntimeException e) {
                log.error("Error reading file {}: {}", path, e.getMessage());
                skipped.add(new BudgetSkip(path, 0, budget - totalTokens, BudgetSkip.Reason.UNREADABLE));
                context.ledger().append(LOAD_OPERATION + path, 0, 0, 0, Outcome.SKIPPED,
                        elapsed(start), tokenCounter.source());
                continue;
            }

            TokenEstimate estimate = tokenCounter.count(content);
            long remaining = budget - totalTokens;
            if (estimate.tokens() <= remaining) {
                contents.put(path, content);
                totalTokens += estimate.tokens();
                context.ledger().append(LOAD_OPERATION + path, estimate.tokens(), 0, 0, Outcome.LOADED,
                        elapsed(start), estimate.source());
                log.debug("Added {}: {} tokens (total: {})", path, estimate.tokens(), totalTokens);
            } else {
                skipped.add(new BudgetSkip(path, estimate.tokens(), remaining, BudgetSkip.Reason.OVER_BUDGET));
                context.ledger().append(LOAD_OPERATION + path, estimate.tokens(), 0, 0, Outcome.SKIPPED,
                        elapsed(start), estimate.source());
                log.warn("Skipping {}: {} tokens would exceed the budget ({} remaining)",
                        path, estimate.tokens(), remaining);
            }
        }

        log.info("Loaded {} files with {} tokens, skipped {} (budget {})",
                contents.size(), totalTokens, skipped.size(), budget);
        return new AssembledContext(fileTree, ranking, contents, context.readme(), totalTokens,
                tokenLimit, budget, tokenCounter.source(), skipped);
    }

    /**
     * The part of the limit that may be filled: {@code floor(tokenLimit * (1 - bufferFraction))}.
     */
    public long effectiveBudget(long tokenLimit) {
        if (tokenLimit == UNLIMITED) {
            return UNLIMITED;
        }
        if (tokenLimit < 0) {
            throw new IllegalArgumentException("Token limit cannot be negative: " + tokenLimit);
        }
        return (long) Math.floor(tokenLimit * (1.0 - bufferFraction) + 1e-9);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
