package com.adlanda.contextassembler.health;

import com.adlanda.contextassembler.model.AssembledContext;
import com.adlanda.contextassembler.model.AssemblyResult;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import com.adlanda.contextassembler.model.TokenSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AssemblyHealthIndicatorTest {

    private AssemblyHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new AssemblyHealthIndicator();
    }

    @Test
    void health_beforeRun_isDown() {
        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Assembly not yet run")
                .containsEntry("lastAttempt", "never");
    }

    @Test
    void health_afterSuccessfulRun_isUpWithDetails() {
        AssembledContext context = new AssembledContext(
                FileTree.of(List.of("main.py", "README.md")),
                new CandidateRanking("rules", List.of(new RankedFile("main.py", 100))),
                Map.of("main.py", "print()"), "# readme", 2, 1000, 950, TokenSource.EXACT, List.of());
        healthIndicator.markHealthy(new AssemblyResult(context, "rules", List.of("ai")));

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("strategy", "rules")
                .containsEntry("fallbackFrom", List.of("ai"))
                .containsEntry("filesInTree", 2)
                .containsEntry("filesLoaded", 1)
                .containsEntry("totalTokens", 2L)
                .containsEntry("tokenBudget", 950L)
                .containsKey("lastRun");
    }

    @Test
    void health_afterFailure_isDownWithError() {
        healthIndicator.markUnhealthy("rules: no files");

        Health health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "rules: no files");
        assertThat(health.getDetails().get("lastAttempt")).isNotEqualTo("never");
    }
}
