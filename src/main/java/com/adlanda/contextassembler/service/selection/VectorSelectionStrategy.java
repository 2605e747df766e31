package com.adlanda.contextassembler.service.selection;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.exception.SelectionFailureException;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import com.adlanda.contextassembler.model.UsageRecord.Outcome;
import com.adlanda.contextassembler.repository.InMemoryVectorIndex;
import com.adlanda.contextassembler.service.EmbeddingService;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks files by embedding similarity to the README and to a generic project-summary query.
 *
 * Flow:
 * 1. Read and embed every candidate (prefix only for large files)
 * 2. Build a fresh in-memory index
 * 3. Query it, keep each file's best similarity above the threshold
 */
@Component
public class VectorSelectionStrategy implements SelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(VectorSelectionStrategy.class);

    public static final String NAME = "vector";

    static final String SUMMARY_QUERY = "Main entry point, core business logic, domain model, "
            + "key workflows, configuration and public API of the project";

    static final String OPERATION = "embed-files";

    private final EmbeddingService embeddingService;
    private final TokenCounter tokenCounter;
    private final int maxFiles;
    private final double minSimilarity;

    @Autowired
    public VectorSelectionStrategy(EmbeddingService embeddingService, TokenCounter tokenCounter,
                                   AssemblyProperties properties) {
        this(embeddingService, tokenCounter, properties.getMaxVectorFiles(), properties.getMinSimilarity());
    }

    VectorSelectionStrategy(EmbeddingService embeddingService, TokenCounter tokenCounter,
                            int maxFiles, double minSimilarity) {
        this.embeddingService = embeddingService;
        this.tokenCounter = tokenCounter;
        this.maxFiles = maxFiles;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return embeddingService.isAvailable();
    }

    @Override
    public CandidateRanking rank(FileTree fileTree, SelectionContext context) {
        if (fileTree.isEmpty()) {
            throw new SelectionFailureException(NAME, "no files to embed");
        }

        InMemoryVectorIndex index = new InMemoryVectorIndex();
        List<String> paths = fileTree.paths();
        List<String> queries = queries(context);
        try {
            List<String> texts = new ArrayList<>(paths.size() + queries.size());
            for (String path : paths) {
                texts.add(embeddingText(path, context));
            }
            texts.addAll(queries);

            long start = System.nanoTime();
            List<float[]> vectors;
            try {
                vectors = embeddingService.embedAll(texts);
            } catch (RuntimeException e) {
                record(texts, Outcome.FAILED, start, context);
                throw e;
            }
            record(texts, Outcome.SUCCEEDED, start, context);
            index.index(paths, vectors.subList(0, paths.size()));

            Map<String, Double> best = new HashMap<>();
            for (float[] queryVector : vectors.subList(paths.size(), vectors.size())) {
                for (RankedFile hit : index.query(queryVector, paths.size())) {
                    best.merge(hit.path(), hit.score(), Math::max);
                }
            }

            List<RankedFile> ranked = best.entrySet().stream()
                    .filter(e -> e.getValue() >= minSimilarity)
                    .map(e -> new RankedFile(e.getKey(), e.getValue()))
                    .sorted(InMemoryVectorIndex.BY_SIMILARITY)
                    .limit(maxFiles)
                    .toList();

            if (ranked.isEmpty()) {
                throw new SelectionFailureException(NAME, "no file reached similarity " + minSimilarity);
            }
            log.info("Vector selection kept {} of {} files (similarity >= {})", ranked.size(), paths.size(), minSimilarity);
            return new CandidateRanking(NAME, ranked);
        } catch (SelectionFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SelectionFailureException(NAME, "embedding backend failed: " + e.getMessage(), e);
        }
    }

    private void record(List<String> texts, Outcome outcome, long startNanos, SelectionContext context) {
        long tokens = texts.stream()
                .mapToLong(t -> tokenCounter.count(embeddingService.prepare(t)).tokens())
                .sum();
        context.ledger().append(OPERATION, tokens, 0, 1, outcome,
                Duration.ofNanos(System.nanoTime() - startNanos), tokenCounter.source());
    }

    private static List<String> queries(SelectionContext context) {
        List<String> queries = new ArrayList<>(2);
        context.readmeContent().ifPresent(queries::add);
        queries.add(SUMMARY_QUERY);
        return queries;
    }

    /**
     * File content to embed; falls back to the path so every candidate gets a vector.
     */
    private static String embeddingText(String path, SelectionContext context) {
        try {
            String content = context.contentReader().read(path);
            return content == null || content.isBlank() ? path : content;
        } catch (IOException e) {
            log.warn("Could not read {} for embedding, indexing its path only: {}", path, e.getMessage());
            return path;
        }
    }
}
