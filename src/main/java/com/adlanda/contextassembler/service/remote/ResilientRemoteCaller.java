package com.adlanda.contextassembler.service.remote;

import com.adlanda.contextassembler.config.AssemblyProperties;
import com.adlanda.contextassembler.exception.RemoteCallException;
import com.adlanda.contextassembler.exception.RemoteFatalException;
import com.adlanda.contextassembler.exception.RemoteTransientException;
import com.adlanda.contextassembler.model.TokenEstimate;
import com.adlanda.contextassembler.model.TokenSource;
import com.adlanda.contextassembler.model.UsageRecord.Outcome;
import com.adlanda.contextassembler.service.UsageLedger;
import com.adlanda.contextassembler.service.token.TokenCounter;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Calls the generative model with bounded exponential backoff on rate limiting.
 *
 * Only {@link RemoteTransientException} is retried; anything else fails the call immediately.
 * Every attempt, successful or not, appends one record to the run's {@link UsageLedger}.
 * Application-level fallback is left to the caller.
 */
@Service
public class ResilientRemoteCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientRemoteCaller.class);

    private final GenerativeModelClient client;
    private final TokenCounter tokenCounter;
    private final RemoteCallDebugWriter debugWriter;
    private final RetryConfig retryConfig;
    private final int maxAttempts;
    private final long maxPromptTokens;

    private volatile RemoteCallState lastState = RemoteCallState.READY;

    public ResilientRemoteCaller(GenerativeModelClient client,
                                 TokenCounter tokenCounter,
                                 RemoteCallDebugWriter debugWriter,
                                 AssemblyProperties properties) {
        AssemblyProperties.Remote remote = properties.getRemote();
        this.client = client;
        this.tokenCounter = tokenCounter;
        this.debugWriter = debugWriter;
        this.maxAttempts = remote.getMaxAttempts();
        this.maxPromptTokens = remote.getMaxPromptTokens();
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        remote.getInitialBackoff().toMillis(),
                        remote.getBackoffMultiplier(),
                        remote.getMaxBackoff().toMillis()))
                .retryOnException(e -> e instanceof RemoteTransientException)
                .build();
    }

    public boolean isAvailable() {
        return client.isAvailable();
    }

    /**
     * Sends a prompt and returns the reply text.
     *
     * @param operation Name recorded in the ledger for every attempt
     * @param prompt    Prompt text
     * @param ledger    Ledger of the current run
     * @throws RemoteTransientException when rate limiting outlasts the retry budget
     * @throws RemoteFatalException     on any other failure
     */
    public String call(String operation, String prompt, UsageLedger ledger) {
        RemoteCall call = new RemoteCall(operation);
        TokenEstimate promptTokens = tokenCounter.count(prompt);
        log.info("Calling generative model for {} (prompt: {} characters, {} tokens)",
                operation, prompt.length(), promptTokens.tokens());

        if (promptTokens.tokens() > maxPromptTokens) {
            ledger.append(operation, promptTokens.tokens(), 0, 0, Outcome.FAILED, Duration.ZERO, promptTokens.source());
            lastState = RemoteCallState.FAILED;
            throw new RemoteFatalException("Prompt for " + operation + " exceeds token limit ("
                    + promptTokens.tokens() + " > " + maxPromptTokens + ")");
        }
        debugWriter.prompt(operation, prompt);

        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "{} rate limited, retrying in {} ms (attempt {} of {})",
                operation, event.getWaitInterval().toMillis(), event.getNumberOfRetryAttempts() + 1, maxAttempts));

        AtomicInteger attempts = new AtomicInteger();
        Supplier<String> attempt = () -> attempt(call, attempts.incrementAndGet(), prompt, promptTokens, ledger);
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } finally {
            lastState = call.state;
        }
    }

    private String attempt(RemoteCall call, int attempt, String prompt, TokenEstimate promptTokens, UsageLedger ledger) {
        call.moveTo(RemoteCallState.CALLING);
        long start = System.nanoTime();
        try {
            ModelReply reply = client.generate(prompt);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            recordSuccess(call.operation, attempt, promptTokens, reply, latency, ledger);
            call.moveTo(RemoteCallState.SUCCEEDED);
            debugWriter.reply(call.operation, reply.text());
            log.info("Received reply for {} ({} characters, {} ms)",
                    call.operation, reply.text() == null ? 0 : reply.text().length(), latency.toMillis());
            return reply.text();
        } catch (RuntimeException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            RemoteCallException failure = RemoteErrorClassifier.classify(e);
            boolean willRetry = failure instanceof RemoteTransientException && attempt < maxAttempts;
            ledger.append(call.operation, promptTokens.tokens(), 0, attempt,
                    willRetry ? Outcome.RATE_LIMITED : Outcome.FAILED, latency, promptTokens.source());
            call.moveTo(willRetry ? RemoteCallState.RETRYING : RemoteCallState.FAILED);
            debugWriter.error(call.operation, attempt, e);
            if (!willRetry) {
                log.error("{} failed after {} attempt(s): {}", call.operation, attempt, failure.getMessage());
            }
            throw failure;
        }
    }

    private void recordSuccess(String operation, int attempt, TokenEstimate promptTokens, ModelReply reply,
                               Duration latency, UsageLedger ledger) {
        if (reply.hasUsage()) {
            ledger.append(operation, reply.promptTokens(), reply.completionTokens(), attempt,
                    Outcome.SUCCEEDED, latency, TokenSource.EXACT);
        } else {
            TokenEstimate output = tokenCounter.count(reply.text());
            ledger.append(operation, promptTokens.tokens(), output.tokens(), attempt,
                    Outcome.SUCCEEDED, latency, tokenCounter.source());
        }
    }

    /**
     * State of the most recent call, for diagnostics.
     */
    public RemoteCallState lastState() {
        return lastState;
    }

    private static final class RemoteCall {

        private final String operation;
        private RemoteCallState state = RemoteCallState.READY;

        private RemoteCall(String operation) {
            this.operation = operation;
        }

        void moveTo(RemoteCallState next) {
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException(operation + ": illegal transition " + state + " -> " + next);
            }
            log.debug("{}: {} -> {}", operation, state, next);
            state = next;
        }
    }
}
