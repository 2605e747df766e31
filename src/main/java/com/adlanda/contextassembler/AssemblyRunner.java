package com.adlanda.contextassembler;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.health.AssemblyHealthIndicator;
import com.adlanda.contextassembler.model.AssembledContext;
import com.adlanda.contextassembler.model.AssemblyResult;
import com.adlanda.contextassembler.service.ContextAssemblyPipeline;
import com.adlanda.contextassembler.service.UsageLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Runs context assembly once on application startup.
 *
 * Scans the configured root, selects and budgets files, then finalizes the usage ledger.
 * The result is kept for the document generator to pick up.
 */
@Component
public class AssemblyRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AssemblyRunner.class);

    private final ContextAssemblyPipeline pipeline;
    private final AssemblyProperties properties;
    private final AssemblyHealthIndicator healthIndicator;

    private volatile AssemblyResult lastResult;
    private volatile UsageLedger lastLedger;

    public AssemblyRunner(ContextAssemblyPipeline pipeline,
                          AssemblyProperties properties,
                          AssemblyHealthIndicator healthIndicator) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.healthIndicator = healthIndicator;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("Context assembly on startup is disabled");
            return;
        }
        Path root = Path.of(properties.getRootDir()).toAbsolutePath().normalize();
        log.info("=== CONTEXT ASSEMBLY START === root: {}", root);
        long start = System.currentTimeMillis();

        UsageLedger ledger = pipeline.newLedger();
        try {
            AssemblyResult result = pipeline.assemble(root, ledger);
            lastResult = result;
            healthIndicator.markHealthy(result);
            logSummary(result, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            healthIndicator.markUnhealthy(e.getMessage());
            log.error("Context assembly failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            ledger.finalizeLedger();
            lastLedger = ledger;
            log.info("=== CONTEXT ASSEMBLY END ===");
        }
    }

    private void logSummary(AssemblyResult result, long durationMs) {
        AssembledContext context = result.context();
        if (result.usedFallback()) {
            log.warn("Selection fell back from {} to '{}'", result.failedStrategies(), result.strategy());
        }
        log.info("""

                Context assembled in {} ms
                  Strategy: {}
                  Files:    {} in tree, {} ranked, {} loaded, {} skipped
                  Tokens:   {} of {} ({})
                  README:   {}
                """,
                durationMs, result.strategy(),
                context.fileTree().size(), context.selected().size(), context.contents().size(), context.skipped().size(),
                context.totalTokens(), context.effectiveBudget(), context.tokenSource(),
                context.readmeContent().isPresent() ? "included" : "not found");
    }

    public Optional<AssemblyResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    public Optional<UsageLedger> getLastLedger() {
        return Optional.ofNullable(lastLedger);
    }
}
