package com.adlanda.contextassembler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The bundle handed to the document generator: file tree, ranking, admitted contents and README.
 *
 * @param fileTree        Filtered project tree
 * @param selected        Ranking the contents were loaded from
 * @param contents        Admitted file contents keyed by path, in ranking order
 * @param readme          README text, or null when the project has none
 * @param totalTokens     Summed token estimate of {@code contents}
 * @param tokenLimit      Configured hard ceiling
 * @param effectiveBudget Ceiling after the buffer fraction is removed
 * @param tokenSource     How the token estimates were computed
 * @param skipped         Candidates that were not admitted, in ranking order
 */
public record AssembledContext(
        FileTree fileTree,
        CandidateRanking selected,
        Map<String, String> contents,
        String readme,
        long totalTokens,
        long tokenLimit,
        long effectiveBudget,
        TokenSource tokenSource,
        List<BudgetSkip> skipped
) {
    public AssembledContext {
        contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
        skipped = List.copyOf(skipped);
    }

    public Optional<String> readmeContent() {
        return Optional.ofNullable(readme);
    }

    public List<String> loadedPaths() {
        return List.copyOf(contents.keySet());
    }
}
