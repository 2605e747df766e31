package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.config.AssemblyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel. The model is optional: when no bean is configured,
 * or the startup check fails, {@link #isAvailable()} is false and the vector strategy is left out.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int maxChars;
    private Boolean available;

    @Autowired
    public EmbeddingService(ObjectProvider<EmbeddingModel> embeddingModel, AssemblyProperties properties) {
        this(embeddingModel.getIfAvailable(), properties.getEmbeddingModel(), properties.getMaxEmbeddingChars());
    }

    public EmbeddingService(EmbeddingModel embeddingModel, String modelName, int maxChars) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.maxChars = maxChars;
    }

    /**
     * Whether an embedding backend is present. Checked once and cached.
     */
    public synchronized boolean isAvailable() {
        if (available == null) {
            available = checkBackend();
        }
        return available;
    }

    private boolean checkBackend() {
        if (embeddingModel == null) {
            log.warn("No embedding model configured; vector selection disabled");
            return false;
        }
        try {
            int dimensions = embeddingModel.dimensions();
            log.info("Embedding model {} available ({} dimensions)", modelName, dimensions);
            return true;
        } catch (RuntimeException e) {
            log.warn("Embedding model {} unreachable; vector selection disabled: {}", modelName, e.getMessage());
            return false;
        }
    }

    /**
     * Generates an embedding vector for the given text.
     */
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds a batch of texts, each truncated to the configured prefix length.
     *
     * @return One vector per text, in input order
     */
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        if (embeddingModel == null) {
            throw new IllegalStateException("No embedding model configured");
        }
        log.info("Generating embeddings for {} texts...", texts.size());

        List<String> prepared = texts.stream().map(this::prepare).toList();
        EmbeddingResponse response = embeddingModel.embedForResponse(prepared);
        List<Embedding> results = new ArrayList<>(response.getResults());
        if (results.size() != texts.size()) {
            throw new IllegalStateException("Embedding backend returned " + results.size()
                    + " vectors for " + texts.size() + " texts");
        }
        results.sort(Comparator.comparingInt(Embedding::getIndex));

        log.info("Generated {} embeddings", results.size());
        return results.stream().map(Embedding::getOutput).toList();
    }

    /**
     * The text actually sent for a given input: its prefix, or a single space for blank input.
     */
    public String prepare(String text) {
        if (text == null || text.isBlank()) {
            return " ";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
