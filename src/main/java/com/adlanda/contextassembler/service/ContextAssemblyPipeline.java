package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.config.AssemblyProperties.SelectionMode;
import com.adlanda.contextassembler.exception.ConfigurationException;
import com.adlanda.contextassembler.model.AssembledContext;
import com.adlanda.contextassembler.model.AssemblyResult;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.service.selection.AiAssistedSelectionStrategy;
import com.adlanda.contextassembler.service.selection.RuleBasedSelectionStrategy;
import com.adlanda.contextassembler.service.selection.SelectionContext;
import com.adlanda.contextassembler.service.selection.SelectionStrategy;
import com.adlanda.contextassembler.service.selection.VectorSelectionStrategy;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Orchestrates one assembly run:
 * 1. Filter the file tree with the ignore rules
 * 2. Rank it with the configured strategies, falling back in order
 * 3. Fill the token budget from the ranking
 *
 * The chain always ends with the rule-based strategy, which cannot fail.
 */
@Service
public class ContextAssemblyPipeline {

    private static final Logger log = LoggerFactory.getLogger(ContextAssemblyPipeline.class);

    private final AssemblyProperties properties;
    private final ProjectScanner scanner;
    private final TokenBudgetLoader budgetLoader;
    private final TokenCounter tokenCounter;
    private final List<SelectionStrategy> chain;
    private final List<PathPattern> includePatterns;

    public ContextAssemblyPipeline(AssemblyProperties properties,
                                   ProjectScanner scanner,
                                   TokenBudgetLoader budgetLoader,
                                   TokenCounter tokenCounter,
                                   VectorSelectionStrategy vectorStrategy,
                                   AiAssistedSelectionStrategy aiStrategy,
                                   RuleBasedSelectionStrategy ruleStrategy) {
        properties.validate();
        this.properties = properties;
        this.scanner = scanner;
        this.budgetLoader = budgetLoader;
        this.tokenCounter = tokenCounter;
        this.chain = buildChain(properties.getSelectionMode(), vectorStrategy, aiStrategy, ruleStrategy);
        this.includePatterns = compileIncludes(properties.getIncludePatterns());
        IgnoreRuleEngine.withPatterns(properties.getExcludePatterns());
    }

    static List<SelectionStrategy> buildChain(SelectionMode mode,
                                              SelectionStrategy vector,
                                              SelectionStrategy ai,
                                              SelectionStrategy rules) {
        List<SelectionStrategy> configured = switch (mode) {
            case VECTOR -> List.of(vector);
            case AI -> List.of(ai);
            case AUTO -> List.of(vector, ai);
            case RULES -> List.of();
        };

        List<SelectionStrategy> chain = new ArrayList<>();
        for (SelectionStrategy strategy : configured) {
            if (strategy.isAvailable()) {
                chain.add(strategy);
            } else {
                log.warn("Selection strategy '{}' is unavailable and will be skipped", strategy.name());
            }
        }
        chain.add(rules);
        log.info("File selection chain for mode {}: {}", mode,
                chain.stream().map(SelectionStrategy::name).toList());
        return List.copyOf(chain);
    }

    private static List<PathPattern> compileIncludes(List<String> patterns) {
        List<PathPattern> compiled = new ArrayList<>();
        for (String line : patterns) {
            Optional<PathPattern> pattern;
            try {
                pattern = PathPattern.parse(line, false);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("assembler.include-patterns: " + e.getMessage());
            }
            if (pattern.isEmpty()) {
                throw new ConfigurationException("assembler.include-patterns contains an unusable pattern: '" + line + "'");
            }
            compiled.add(pattern.get());
        }
        return List.copyOf(compiled);
    }

    /**
     * Creates the ledger for a run, using this pipeline's token source.
     */
    public UsageLedger newLedger() {
        return new UsageLedger(tokenCounter.source());
    }

    /**
     * Runs the pipeline against a directory on disk.
     */
    public AssemblyResult assemble(Path root, UsageLedger ledger) {
        IgnoreRuleEngine ignoreRules = IgnoreRuleEngine.forProject(root, properties.getExcludePatterns());
        List<String> rawPaths = scanner.scan(root, ignoreRules);
        String readme = scanner.readReadme(root).orElse(null);
        return assemble(rawPaths, readme, scanner.contentReader(root), ignoreRules, ledger);
    }

    /**
     * Runs the pipeline against an already-listed file system snapshot.
     *
     * @param rawPaths      Relative paths as produced by a scanner
     * @param readme        README text, or null
     * @param contentReader Reads file contents by relative path
     * @param ignoreRules   Rules to filter {@code rawPaths} with
     * @param ledger        Ledger of the run; left open for the caller to finalize
     */
    public AssemblyResult assemble(Collection<String> rawPaths,
                                   String readme,
                                   FileContentReader contentReader,
                                   IgnoreRuleEngine ignoreRules,
                                   UsageLedger ledger) {
        FileTree fileTree = applyIncludes(ignoreRules.filter(rawPaths));
        log.info("File tree: {} of {} paths kept after ignore rules", fileTree.size(), rawPaths.size());

        SelectionContext context = new SelectionContext(readme, contentReader, ledger);
        List<String> failed = new ArrayList<>();
        CandidateRanking ranking = select(fileTree, context, failed);

        AssembledContext assembled = budgetLoader.load(ranking, properties.getTokenLimit(), fileTree, context);
        return new AssemblyResult(assembled, ranking.strategy(), failed);
    }

    private FileTree applyIncludes(FileTree fileTree) {
        if (includePatterns.isEmpty()) {
            return fileTree;
        }
        List<String> kept = fileTree.paths().stream()
                .filter(path -> includePatterns.stream().anyMatch(p -> p.matches(path)))
                .toList();
        log.info("Include patterns kept {} of {} files", kept.size(), fileTree.size());
        return new FileTree(kept);
    }

    private CandidateRanking select(FileTree fileTree, SelectionContext context, List<String> failed) {
        for (SelectionStrategy strategy : chain) {
            boolean last = strategy == chain.get(chain.size() - 1);
            try {
                CandidateRanking ranking = strategy.rank(fileTree, context);
                if (ranking.isEmpty() && !last) {
                    log.warn("Selection strategy '{}' returned no files, falling back", strategy.name());
                    failed.add(strategy.name());
                    continue;
                }
                log.info("Using {} ranked files from '{}' strategy", ranking.size(), strategy.name());
                return ranking;
            } catch (RuntimeException e) {
                if (last) {
                    throw e;
                }
                log.warn("Selection strategy '{}' failed, falling back: {}", strategy.name(), e.getMessage());
                failed.add(strategy.name());
            }
        }
        throw new IllegalStateException("Selection chain is empty");
    }

    /**
     * Names of the strategies tried, in order; the rule-based fallback is always last.
     */
    public List<String> chainNames() {
        return chain.stream().map(SelectionStrategy::name).toList();
    }
}
