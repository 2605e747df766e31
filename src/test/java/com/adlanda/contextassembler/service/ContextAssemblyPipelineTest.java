package com.adlanda.contextassembler.service;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.config.AssemblyProperties.SelectionMode;
import com.adlanda.contextassembler.exception.ConfigurationException;
import com.adlanda.contextassembler.model.AssemblyResult;
import com.adlanda.contextassembler.model.UsageRecord;
import com.adlanda.contextassembler.service.remote.ResilientRemoteCaller;
import com.adlanda.contextassembler.service.selection.AiAssistedSelectionStrategy;
import com.adlanda.contextassembler.service.selection.RuleBasedSelectionStrategy;
import com.adlanda.contextassembler.service.selection.VectorSelectionStrategy;
import com.adlanda.contextassembler.service.token.EstimatingTokenCounter;
import com.adlanda.contextassembler.service.token.TokenCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextAssemblyPipelineTest {

    private static final Map<String, String> CONTENTS = Map.of(
            "a/main.py", "print('hello')",
            "a/test_main.py", "def test_main(): pass",
            "README.md", "# Demo");

    @Mock
    private ResilientRemoteCaller remoteCaller;

    @TempDir
    Path tempDir;

    private AssemblyProperties properties;
    private TokenCounter tokenCounter;
    private VectorSelectionStrategy vectorStrategy;
    private AiAssistedSelectionStrategy aiStrategy;

    @BeforeEach
    void setUp() {
        properties = new AssemblyProperties();
        tokenCounter = new EstimatingTokenCounter();
        // no embedding backend: the vector strategy reports itself unavailable
        vectorStrategy = new VectorSelectionStrategy(new EmbeddingService(null, "none", 8000), tokenCounter, properties);
        aiStrategy = new AiAssistedSelectionStrategy(remoteCaller, new FileTreeRenderer());
    }

    private ContextAssemblyPipeline pipeline() {
        return new ContextAssemblyPipeline(properties, new ProjectScanner(),
                new TokenBudgetLoader(tokenCounter, properties), tokenCounter,
                vectorStrategy, aiStrategy, new RuleBasedSelectionStrategy());
    }

    private AssemblyResult assemble(ContextAssemblyPipeline pipeline, List<String> excludes) {
        List<String> raw = List.of("a/main.py", "a/test_main.py", "assets/logo.png", "README.md");
        return pipeline.assemble(raw, CONTENTS.get("README.md"), CONTENTS::get,
                IgnoreRuleEngine.withPatterns(excludes), pipeline.newLedger());
    }

    @Test
    void assemble_malformedAiReply_fallsBackToRules() {
        properties.setSelectionMode(SelectionMode.AI);
        when(remoteCaller.isAvailable()).thenReturn(true);
        when(remoteCaller.call(anyString(), anyString(), any())).thenReturn("I think main.py matters most");
        ContextAssemblyPipeline pipeline = pipeline();

        AssemblyResult result = assemble(pipeline, List.of("assets/"));

        assertThat(result.strategy()).isEqualTo(RuleBasedSelectionStrategy.NAME);
        assertThat(result.failedStrategies()).containsExactly(AiAssistedSelectionStrategy.NAME);
        assertThat(result.usedFallback()).isTrue();
        assertThat(result.context().selected().paths())
                .containsExactly("a/main.py", "README.md", "a/test_main.py");
    }

    @Test
    void assemble_validAiReply_usesAiRanking() {
        properties.setSelectionMode(SelectionMode.AI);
        when(remoteCaller.isAvailable()).thenReturn(true);
        when(remoteCaller.call(anyString(), anyString(), any())).thenReturn("[\"a/test_main.py\", \"a/main.py\"]");

        AssemblyResult result = assemble(pipeline(), List.of());

        assertThat(result.strategy()).isEqualTo(AiAssistedSelectionStrategy.NAME);
        assertThat(result.usedFallback()).isFalse();
        assertThat(result.context().loadedPaths()).containsExactly("a/test_main.py", "a/main.py");
    }

    @Test
    void assemble_ignoredPathsNeverReachAnyRanking() {
        properties.setSelectionMode(SelectionMode.RULES);

        AssemblyResult result = assemble(pipeline(), List.of("assets/"));

        assertThat(result.context().fileTree().paths()).doesNotContain("assets/logo.png");
        assertThat(result.context().selected().paths()).doesNotContain("assets/logo.png");
    }

    @Test
    void assemble_loadsWithinTokenLimitAndRecordsLoads() {
        properties.setSelectionMode(SelectionMode.RULES);
        properties.setTokenLimit(6);
        ContextAssemblyPipeline pipeline = pipeline();
        UsageLedger ledger = pipeline.newLedger();

        AssemblyResult result = pipeline.assemble(List.of("a/main.py", "a/test_main.py", "README.md"),
                "# Demo", CONTENTS::get, IgnoreRuleEngine.withPatterns(List.of()), ledger);

        // budget floor(6 * 0.95) = 5: main.py (4 tokens) fits, README.md (2) would not, test file (6) would not
        assertThat(result.context().loadedPaths()).containsExactly("a/main.py");
        assertThat(result.context().totalTokens()).isEqualTo(4);
        assertThat(ledger.records()).extracting(UsageRecord::operation)
                .containsExactly("load:a/main.py", "load:README.md", "load:a/test_main.py");
    }

    @Test
    void chain_unavailableStrategiesAreSkipped() {
        properties.setSelectionMode(SelectionMode.AUTO);
        when(remoteCaller.isAvailable()).thenReturn(false);

        assertThat(pipeline().chainNames()).containsExactly(RuleBasedSelectionStrategy.NAME);
    }

    @Test
    void chain_autoModeTriesVectorThenAiThenRules() {
        properties.setSelectionMode(SelectionMode.AUTO);
        when(remoteCaller.isAvailable()).thenReturn(true);
        VectorSelectionStrategy available = new VectorSelectionStrategy(
                new EmbeddingService(null, "none", 8000), tokenCounter, properties) {
            @Override
            public boolean isAvailable() {
                return true;
            }
        };
        vectorStrategy = available;

        assertThat(pipeline().chainNames()).containsExactly(
                VectorSelectionStrategy.NAME, AiAssistedSelectionStrategy.NAME, RuleBasedSelectionStrategy.NAME);
    }

    @Test
    void assemble_includePatternsRestrictCandidates() {
        properties.setSelectionMode(SelectionMode.RULES);
        properties.setIncludePatterns(List.of("*.md"));

        AssemblyResult result = assemble(pipeline(), List.of());

        assertThat(result.context().fileTree().paths()).containsExactly("README.md");
    }

    @Test
    void assemble_fromDirectory_scansReadsAndLoads() throws IOException {
        properties.setSelectionMode(SelectionMode.RULES);
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/main.py"), "print('hi')");
        Files.writeString(tempDir.resolve("README.md"), "# Sample");
        Files.writeString(tempDir.resolve(".gitignore"), "secrets/\n");
        Files.createDirectories(tempDir.resolve("secrets"));
        Files.writeString(tempDir.resolve("secrets/key.txt"), "hunter2");
        ContextAssemblyPipeline pipeline = pipeline();

        AssemblyResult result = pipeline.assemble(tempDir, pipeline.newLedger());

        assertThat(result.context().loadedPaths()).containsExactly("src/main.py", ".gitignore", "README.md");
        assertThat(result.context().readmeContent()).contains("# Sample");
    }

    @Test
    void constructor_invalidConfiguration_throwsConfigurationException() {
        properties.setMinSimilarity(1.5);

        assertThatThrownBy(this::pipeline).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("min-similarity");
    }

    @Test
    void constructor_uncompilableIncludePattern_throwsConfigurationException() {
        properties.setIncludePatterns(List.of("src/[z-a]*.py"));

        assertThatThrownBy(this::pipeline).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("include-patterns");
    }

    @Test
    void constructor_uncompilableExcludePattern_throwsConfigurationException() {
        properties.setExcludePatterns(List.of("[z-a].txt"));

        assertThatThrownBy(this::pipeline).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("exclude-patterns");
    }
}
