package com.adlanda.contextassembler.config;

import com.adlanda.contextassembler.exception.ConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for file selection and context assembly.
 *
 * Maps to properties prefixed with 'assembler' in application.properties.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "assembler")
public class AssemblyProperties {

    /**
     * Root directory of the project to assemble.
     */
    @NotBlank
    private String rootDir = ".";

    /**
     * Whether the pipeline runs once at startup.
     * When false, nothing is scanned (useful for testing).
     */
    private boolean runOnStartup = true;

    @NotNull
    private SelectionMode selectionMode = SelectionMode.VECTOR;

    /**
     * When non-empty, only paths matching one of these globs are candidates.
     */
    private List<String> includePatterns = new ArrayList<>();

    /**
     * Extra ignore patterns, same syntax as .gitignore lines.
     */
    private List<String> excludePatterns = new ArrayList<>();

    private String embeddingModel = "text-embedding-3-small";

    @Min(1)
    private int maxVectorFiles = 50;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minSimilarity = 0.6;

    /**
     * Only this many leading characters of a file are embedded.
     */
    @Min(1)
    private int maxEmbeddingChars = 8000;

    @Min(1)
    private long tokenLimit = 1_800_000L;

    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double bufferFraction = 0.05;

    @NotNull
    private TokenizerMode tokenizer = TokenizerMode.EXACT;

    /**
     * Write every prompt, raw reply and error to {@link #debugDir}.
     */
    private boolean debugRemoteCalls = false;

    @NotBlank
    private String debugDir = ".assembler/debug";

    @Valid
    private Remote remote = new Remote();

    /**
     * Rejects option combinations that bean validation cannot express.
     *
     * @throws ConfigurationException if any option is out of range
     */
    public void validate() {
        if (rootDir == null || rootDir.isBlank()) {
            throw new ConfigurationException("assembler.root-dir must be set");
        }
        if (selectionMode == null) {
            throw new ConfigurationException("assembler.selection-mode must be one of vector, ai, auto, rules");
        }
        if (tokenizer == null) {
            throw new ConfigurationException("assembler.tokenizer must be one of exact, estimate");
        }
        if (tokenLimit < 1) {
            throw new ConfigurationException("assembler.token-limit must be positive, was " + tokenLimit);
        }
        if (bufferFraction < 0.0 || bufferFraction >= 1.0) {
            throw new ConfigurationException("assembler.buffer-fraction must be in [0, 1), was " + bufferFraction);
        }
        if (minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new ConfigurationException("assembler.min-similarity must be in [0, 1], was " + minSimilarity);
        }
        if (maxVectorFiles < 1) {
            throw new ConfigurationException("assembler.max-vector-files must be positive, was " + maxVectorFiles);
        }
        if (maxEmbeddingChars < 1) {
            throw new ConfigurationException("assembler.max-embedding-chars must be positive, was " + maxEmbeddingChars);
        }
        if (debugRemoteCalls && (debugDir == null || debugDir.isBlank())) {
            throw new ConfigurationException("assembler.debug-dir must be set when debug-remote-calls is enabled");
        }
        remote.validate();
    }

    public enum SelectionMode {
        VECTOR,
        AI,
        /** Vector first, then AI-assisted. */
        AUTO,
        /** Rule-based only. */
        RULES
    }

    public enum TokenizerMode {
        EXACT,
        ESTIMATE
    }

    /**
     * Retry and limit settings for calls to the generative model.
     */
    public static class Remote {

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(2);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(60);

        @Min(1)
        private long maxPromptTokens = 1_800_000L;

        void validate() {
            if (maxAttempts < 1) {
                throw new ConfigurationException("assembler.remote.max-attempts must be at least 1, was " + maxAttempts);
            }
            if (initialBackoff == null || initialBackoff.toMillis() < 1) {
                throw new ConfigurationException("assembler.remote.initial-backoff must be at least 1ms");
            }
            if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
                throw new ConfigurationException("assembler.remote.max-backoff must not be shorter than initial-backoff");
            }
            if (backoffMultiplier < 1.0) {
                throw new ConfigurationException("assembler.remote.backoff-multiplier must be >= 1.0, was " + backoffMultiplier);
            }
            if (maxPromptTokens < 1) {
                throw new ConfigurationException("assembler.remote.max-prompt-tokens must be positive");
            }
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public long getMaxPromptTokens() {
            return maxPromptTokens;
        }

        public void setMaxPromptTokens(long maxPromptTokens) {
            this.maxPromptTokens = maxPromptTokens;
        }
    }

    public String getRootDir() {
        return rootDir;
    }

    public void setRootDir(String rootDir) {
        this.rootDir = rootDir;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public SelectionMode getSelectionMode() {
        return selectionMode;
    }

    public void setSelectionMode(SelectionMode selectionMode) {
        this.selectionMode = selectionMode;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
        this.includePatterns = includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
        this.excludePatterns = excludePatterns;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public void setEmbeddingModel(String embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    public int getMaxVectorFiles() {
        return maxVectorFiles;
    }

    public void setMaxVectorFiles(int maxVectorFiles) {
        this.maxVectorFiles = maxVectorFiles;
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public void setMinSimilarity(double minSimilarity) {
        this.minSimilarity = minSimilarity;
    }

    public int getMaxEmbeddingChars() {
        return maxEmbeddingChars;
    }

    public void setMaxEmbeddingChars(int maxEmbeddingChars) {
        this.maxEmbeddingChars = maxEmbeddingChars;
    }

    public long getTokenLimit() {
        return tokenLimit;
    }

    public void setTokenLimit(long tokenLimit) {
        this.tokenLimit = tokenLimit;
    }

    public double getBufferFraction() {
        return bufferFraction;
    }

    public void setBufferFraction(double bufferFraction) {
        this.bufferFraction = bufferFraction;
    }

    public TokenizerMode getTokenizer() {
        return tokenizer;
    }

    public void setTokenizer(TokenizerMode tokenizer) {
        this.tokenizer = tokenizer;
    }

    public boolean isDebugRemoteCalls() {
        return debugRemoteCalls;
    }

    public void setDebugRemoteCalls(boolean debugRemoteCalls) {
        this.debugRemoteCalls = debugRemoteCalls;
    }

    public String getDebugDir() {
        return debugDir;
    }

    public void setDebugDir(String debugDir) {
        this.debugDir = debugDir;
    }

    public Remote getRemote() {
        return remote;
    }

    public void setRemote(Remote remote) {
        this.remote = remote;
    }
}
