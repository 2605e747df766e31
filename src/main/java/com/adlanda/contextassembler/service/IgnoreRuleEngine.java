package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.exception.ConfigurationException;
import com.adlanda.contextassembler.model.FileTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Decides which project paths never reach selection.
 *
 * Combines a built-in baseline (VCS metadata, IDE settings, build and dependency directories,
 * binary and media files) with the project's .gitignore and any configured extra patterns.
 * A path is ignored iff any pattern matches it.
 */
public class IgnoreRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(IgnoreRuleEngine.class);

    public static final String IGNORE_FILE = ".gitignore";

    static final List<String> BASELINE = List.of(
            // version control and IDE metadata
            ".git/", ".svn/", ".hg/", ".idea/", ".vscode/", ".settings/", ".DS_Store",
            // dependency and build output directories
            "node_modules/", "vendor/", "__pycache__/", ".venv/", "venv/", ".gradle/", ".mvn/",
            "dist/", "build/", "target/", "coverage/", ".cache/", "cache/", "tmp/", "temp/", "log/", "logs/",
            ".assembler/",
            // compiled and packaged binaries
            "*.class", "*.jar", "*.war", "*.ear", "*.pyc", "*.pyo", "*.o", "*.so", "*.dll", "*.dylib", "*.exe",
            "*.zip", "*.tar", "*.gz", "*.tgz", "*.7z", "*.rar",
            // images, fonts and media
            "*.jpg", "*.jpeg", "*.png", "*.gif", "*.bmp", "*.webp", "*.svg", "*.ico",
            "*.woff", "*.woff2", "*.ttf", "*.otf", "*.eot",
            "*.mp3", "*.mp4", "*.wav", "*.mov", "*.avi", "*.mkv", "*.pdf", "*.psd",
            "*.log"
    );

    private final List<PathPattern> patterns;

    private IgnoreRuleEngine(List<PathPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Engine with the baseline and the given extra patterns only.
     *
     * @throws ConfigurationException if an extra pattern does not compile
     */
    public static IgnoreRuleEngine withPatterns(Collection<String> extraPatterns) {
        List<PathPattern> compiled = baseline();
        compiled.addAll(compileConfigured(extraPatterns));
        return new IgnoreRuleEngine(compiled);
    }

    /**
     * Engine with the baseline, the project's .gitignore (if readable) and the extra patterns.
     * Unusable .gitignore lines are logged and skipped.
     *
     * @throws ConfigurationException if an extra pattern does not compile
     */
    public static IgnoreRuleEngine forProject(Path root, Collection<String> extraPatterns) {
        List<PathPattern> compiled = baseline();
        Path ignoreFile = root.resolve(IGNORE_FILE);
        for (String line : readIgnoreFile(ignoreFile)) {
            try {
                PathPattern.parse(line, false).ifPresent(compiled::add);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unusable line in {}: {}", ignoreFile, e.getMessage());
            }
        }
        compiled.addAll(compileConfigured(extraPatterns));
        IgnoreRuleEngine engine = new IgnoreRuleEngine(compiled);
        log.info("Ignore rules: {} baseline, {} from {} and configuration",
                BASELINE.size(), engine.size() - BASELINE.size(), IGNORE_FILE);
        return engine;
    }

    private static List<PathPattern> baseline() {
        List<PathPattern> compiled = new ArrayList<>();
        BASELINE.forEach(line -> PathPattern.parse(line, true).ifPresent(compiled::add));
        return compiled;
    }

    private static List<PathPattern> compileConfigured(Collection<String> patterns) {
        List<PathPattern> compiled = new ArrayList<>();
        for (String line : patterns) {
            try {
                PathPattern.parse(line, false).ifPresent(compiled::add);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("assembler.exclude-patterns: " + e.getMessage());
            }
        }
        return compiled;
    }

    static List<String> readIgnoreFile(Path ignoreFile) {
        if (!Files.isRegularFile(ignoreFile)) {
            log.debug("No {} found at {}", IGNORE_FILE, ignoreFile);
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(ignoreFile, StandardCharsets.UTF_8);
            long negations = lines.stream().map(String::strip).filter(l -> l.startsWith("!")).count();
            if (negations > 0) {
                log.debug("Skipping {} negation patterns in {} (not supported)", negations, ignoreFile);
            }
            return lines;
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read {}, continuing without it: {}", ignoreFile, e.getMessage());
            return List.of();
        }
    }

    public boolean shouldIgnore(String path) {
        String normalized = FileTree.normalize(path);
        if (normalized.isEmpty()) {
            return true;
        }
        String[] segments = normalized.split("/");
        for (PathPattern pattern : patterns) {
            if (pattern.matches(segments)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a whole directory can be pruned while walking.
     */
    public boolean shouldIgnoreDirectory(String directory) {
        String normalized = FileTree.normalize(directory);
        if (normalized.isEmpty()) {
            return false;
        }
        String[] segments = normalized.split("/");
        for (PathPattern pattern : patterns) {
            if (pattern.matchesDirectory(segments)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Normalizes, deduplicates and drops ignored paths. Applying it twice changes nothing.
     */
    public FileTree filter(Collection<String> rawPaths) {
        FileTree tree = FileTree.of(rawPaths);
        List<String> kept = tree.paths().stream()
                .filter(p -> !shouldIgnore(p))
                .toList();
        if (kept.size() < tree.size()) {
            log.debug("Ignore rules removed {} of {} paths", tree.size() - kept.size(), tree.size());
        }
        return new FileTree(kept);
    }

    public int size() {
        return patterns.size();
    }
}
