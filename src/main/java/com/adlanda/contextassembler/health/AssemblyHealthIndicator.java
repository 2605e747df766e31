package com.adlanda.contextassembler.health;

import com.adlanda.contextassembler.model.AssembledContext;
import com.adlanda.contextassembler.model.AssemblyResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the context assembly run.
 *
 * Reports the outcome of the last run, including:
 * - Which selection strategy produced the ranking and which ones fell back
 * - Number of files ranked, loaded and skipped
 * - Tokens used against the budget
 * - Error details if the run failed
 */
@Component
public class AssemblyHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(false, null, "Assembly not yet run", null)
    );

    public void markHealthy(AssemblyResult result) {
        state.set(new HealthState(true, result, null, Instant.now()));
    }

    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            AssembledContext context = current.result().context();
            return Health.up()
                    .withDetail("lastRun", current.timestamp().toString())
                    .withDetail("strategy", current.result().strategy())
                    .withDetail("fallbackFrom", current.result().failedStrategies())
                    .withDetail("filesInTree", context.fileTree().size())
                    .withDetail("filesRanked", context.selected().size())
                    .withDetail("filesLoaded", context.contents().size())
                    .withDetail("filesSkipped", context.skipped().size())
                    .withDetail("totalTokens", context.totalTokens())
                    .withDetail("tokenBudget", context.effectiveBudget())
                    .withDetail("tokenSource", context.tokenSource().name())
                    .build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    private record HealthState(
            boolean healthy,
            AssemblyResult result,
            String error,
            Instant timestamp
    ) {}
}
