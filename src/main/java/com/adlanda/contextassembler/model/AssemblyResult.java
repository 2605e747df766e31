package com.adlanda.contextassembler.model;

import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * @param context          The assembled bundle
 * @param strategy         Strategy whose ranking was used
 * @param failedStrategies Strategies that were tried first and failed, in order
 */
public record AssemblyResult(AssembledContext context, String strategy, List<String> failedStrategies) {

    public AssemblyResult {
        failedStrategies = List.copyOf(failedStrategies);
    }

    public boolean usedFallback() {
        return !failedStrategies.isEmpty();
    }
}
