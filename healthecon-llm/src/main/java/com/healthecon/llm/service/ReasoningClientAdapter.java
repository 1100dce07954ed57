package com.healthecon.llm.service;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.llm.client.ReasoningClient;
import com.healthecon.llm.client.ReasoningClient.ReasoningServiceException;
import com.healthecon.llm.config.ReasoningProperties;
import com.healthecon.llm.config.RetryPolicy;
import com.healthecon.llm.model.BillContent;
import com.healthecon.llm.model.ReasoningRequest;
import com.healthecon.llm.model.ReasoningResponse;
import com.healthecon.llm.model.ReasoningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Resilient invocation of the reasoning service: per-attempt timeout, exponential backoff with jitter
 * for transient failures, immediate failure for permanent ones.
 * Attempts run one after another on the calling thread, so an invocation never has two calls outstanding.
 */
@Service
@Slf4j
public class ReasoningClientAdapter {

    private final ReasoningClient client;
    private final RetryPolicy retryPolicy;

    private final AtomicLong invocations = new AtomicLong();
    private final AtomicLong attemptsMade = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final Map<ErrorKind, AtomicLong> failuresByKind = new EnumMap<>(ErrorKind.class);

    @Autowired
    public ReasoningClientAdapter(ReasoningClient client, ReasoningProperties properties) {
        this(client, properties.toRetryPolicy());
    }

    public ReasoningClientAdapter(ReasoningClient client, RetryPolicy retryPolicy) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        for (ErrorKind kind : ErrorKind.values()) {
            failuresByKind.put(kind, new AtomicLong());
        }
        log.info("[REASONING] Adapter initialized | model={} | configured={} | maxAttempts={} | timeoutMs={} | baseDelayMs={} | jitterMs={}",
            client.getDefaultModel(), client.isConfigured(), retryPolicy.getMaxAttempts(),
            retryPolicy.getAttemptTimeout().toMillis(), retryPolicy.getBaseDelay().toMillis(),
            retryPolicy.getJitter().toMillis());
    }

    public ReasoningResult invoke(ReasoningRequest request) throws ExternalServiceException {
        return execute("query", timeout -> client.complete(request, timeout));
    }

    public ReasoningResult summarizeBill(BillContent bill) throws ExternalServiceException {
        return execute("bill-summary", timeout -> client.describeBill(bill, timeout));
    }

    public boolean isConfigured() {
        return client.isConfigured();
    }

    private ReasoningResult execute(String operation, Function<Duration, ReasoningResponse> attemptCall) {
        long invocationStart = System.currentTimeMillis();
        long invocationId = invocations.incrementAndGet();
        int maxAttempts = retryPolicy.getMaxAttempts();
        ReasoningServiceException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long attemptStart = System.currentTimeMillis();
            attemptsMade.incrementAndGet();

            try {
                ReasoningResponse response = attempt(attemptCall);
                long latency = System.currentTimeMillis() - attemptStart;
                successes.incrementAndGet();

                log.info("[REASONING] Attempt succeeded | invocation={} | operation={} | attempt={}/{} | latencyMs={} | outcome=SUCCESS | answerLength={}",
                    invocationId, operation, attempt, maxAttempts, latency, response.getAnswer().length());

                return ReasoningResult.builder()
                    .answer(response.getAnswer())
                    .model(response.getModel())
                    .attempts(attempt)
                    .latencyMs(System.currentTimeMillis() - invocationStart)
                    .build();
            } catch (ReasoningServiceException e) {
                long latency = System.currentTimeMillis() - attemptStart;
                lastError = e;

                log.warn("[REASONING] Attempt failed | invocation={} | operation={} | attempt={}/{} | latencyMs={} | outcome={} | transient={} | statusCode={} | error={}",
                    invocationId, operation, attempt, maxAttempts, latency, e.getKind(), e.isTransient(), e.getStatusCode(), e.getMessage());

                if (!e.isTransient()) {
                    failuresByKind.get(e.getKind()).incrementAndGet();
                    throw new ExternalServiceException(
                        "Reasoning service rejected the request (" + e.getKind() + "): " + e.getMessage(),
                        e.getKind(), attempt, e.getKind(), e);
                }

                if (attempt < maxAttempts) {
                    long delay = retryPolicy.backoffMillis(attempt, sampleJitter());
                    retries.incrementAndGet();
                    log.info("[REASONING] Backing off before retry | invocation={} | nextAttempt={} | delayMs={}",
                        invocationId, attempt + 1, delay);
                    sleep(delay, invocationId, attempt, e);
                }
            }
        }

        failuresByKind.get(ErrorKind.RETRIES_EXHAUSTED).incrementAndGet();
        log.error("[REASONING] Retries exhausted | invocation={} | operation={} | attempts={} | totalDurationMs={} | lastKind={}",
            invocationId, operation, maxAttempts, System.currentTimeMillis() - invocationStart,
            lastError != null ? lastError.getKind() : null);

        throw new ExternalServiceException(
            "Reasoning service still failing after " + maxAttempts + " attempts"
                + (lastError != null ? " (last error " + lastError.getKind() + ": " + lastError.getMessage() + ")" : ""),
            ErrorKind.RETRIES_EXHAUSTED, maxAttempts, lastError != null ? lastError.getKind() : null, lastError);
    }

    private ReasoningResponse attempt(Function<Duration, ReasoningResponse> attemptCall) {
        try {
            return attemptCall.apply(retryPolicy.getAttemptTimeout());
        } catch (ReasoningServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            // Unclassified client failure, treated like a 5xx
            throw new ReasoningServiceException(
                "Reasoning request failed: " + e.getMessage(), ErrorKind.SERVER_ERROR, 500, e);
        }
    }

    private long sampleJitter() {
        long bound = retryPolicy.getJitter().toMillis();
        return bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound + 1);
    }

    private void sleep(long ms, long invocationId, int attempt, ReasoningServiceException lastError) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(
                "Interrupted during retry backoff of invocation " + invocationId,
                lastError.getKind(), attempt, lastError.getKind(), e);
        }
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("model", client.getDefaultModel());
        stats.put("configured", client.isConfigured());
        stats.put("invocations", invocations.get());
        stats.put("attempts", attemptsMade.get());
        stats.put("retries", retries.get());
        stats.put("successes", successes.get());

        Map<String, Long> failures = new LinkedHashMap<>();
        failuresByKind.forEach((kind, count) -> {
            if (count.get() > 0) {
                failures.put(kind.name(), count.get());
            }
        });
        stats.put("failures", failures);
        return stats;
    }
}
