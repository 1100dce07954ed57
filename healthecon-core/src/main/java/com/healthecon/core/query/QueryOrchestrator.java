package com.healthecon.core.query;

import com.healthecon.common.constants.ErrorKind;
import com.healthecon.common.exception.StorageException;
import com.healthecon.common.exception.ValidationException;
import com.healthecon.core.fingerprint.Fingerprint;
import com.healthecon.core.fingerprint.FingerprintBuilder;
import com.healthecon.core.inflight.CallResult;
import com.healthecon.core.inflight.InflightCoordinator;
import com.healthecon.core.inflight.InflightHandle;
import com.healthecon.core.query.model.SubmissionOutcome;
import com.healthecon.core.query.model.SubmissionOutcome.Source;
import com.healthecon.core.service.BillService;
import com.healthecon.core.store.ErrorInfo;
import com.healthecon.core.store.ResultStore;
import com.healthecon.data.entity.QueryRecord;
import com.healthecon.llm.model.ReasoningRequest;
import com.healthecon.llm.model.ReasoningResult;
import com.healthecon.llm.service.ExternalServiceException;
import com.healthecon.llm.service.ReasoningClientAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Entry point for research queries: cache lookup, single-flight execution, and recording of the outcome.
 * A query moves pending -> inFlight -> complete | failed and never leaves a terminal status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryOrchestrator {
    
    private final FingerprintBuilder fingerprintBuilder;
    private final ResultStore resultStore;
    private final InflightCoordinator coordinator;
    private final ReasoningClientAdapter reasoningAdapter;
    private final BillService billService;
    
    /**
     * Blocking submission. External failures come back as a failed query, never as an exception.
     */
    public SubmissionOutcome submit(String rawText, Collection<String> billRefs) {
        CompletableFuture<SubmissionOutcome> future = submitAsync(rawText, billRefs);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for query outcome");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new StorageException("Query execution failed", cause);
        }
    }
    
    /**
     * Validates bill references and fingerprints on the calling thread, then returns a future owned by this caller.
     * Cancelling the future abandons this caller's wait only; the shared call keeps running.
     */
    public CompletableFuture<SubmissionOutcome> submitAsync(String rawText, Collection<String> billRefs) {
        long startTime = System.currentTimeMillis();
        List<String> refs = fingerprintBuilder.sortRefs(billRefs);
        Set<String> unknown = billService.findUnknown(refs);
        if (!unknown.isEmpty()) {
            log.warn("[QUERY_ORCH] Rejected unknown bill references | refs={} | unknown={}", refs.size(), unknown);
            throw new ValidationException("Unknown bill references: " + unknown);
        }
        
        Fingerprint fingerprint = fingerprintBuilder.fingerprint(rawText, refs);
        
        Optional<QueryRecord> cached = resultStore.lookup(fingerprint.getValue());
        if (cached.isPresent()) {
            log.info("[QUERY_ORCH] Served from cache | queryId={} | fingerprint={} | durationMs={}",
                cached.get().getId(), fingerprint.shortValue(), System.currentTimeMillis() - startTime);
            return CompletableFuture.completedFuture(new SubmissionOutcome(cached.get(), Source.CACHE));
        }
        
        InflightHandle handle = coordinator.join(fingerprint.getValue(), () -> execute(fingerprint, rawText));
        
        CompletableFuture<SubmissionOutcome> outcome = handle.outcome()
            .thenApply(result -> new SubmissionOutcome(result.getQuery(), sourceOf(result, handle)));
        outcome.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                handle.abandon();
            } else if (result != null) {
                log.info("[QUERY_ORCH] Submission resolved | queryId={} | status={} | source={} | durationMs={}",
                    result.getQuery().getId(), result.getQuery().getStatus(), result.getSource(),
                    System.currentTimeMillis() - startTime);
            }
        });
        return outcome;
    }
    
    private static Source sourceOf(CallResult result, InflightHandle handle) {
        if (result.isReused()) {
            return Source.CACHE;
        }
        return handle.isLeader() ? Source.EXECUTED : Source.JOINED;
    }
    
    /**
     * Leader work for one fingerprint. Runs on the coordinator's executor.
     * Only storage failures escape; anything else is recorded on the query as a failure.
     */
    CallResult execute(Fingerprint fingerprint, String rawText) {
        // A call that resolved between our cache miss and joining may already have answered this
        Optional<QueryRecord> cached = resultStore.lookup(fingerprint.getValue());
        if (cached.isPresent()) {
            log.info("[QUERY_ORCH] Cache filled while joining | queryId={} | fingerprint={}",
                cached.get().getId(), fingerprint.shortValue());
            return CallResult.reused(cached.get());
        }
        
        QueryRecord record = resultStore.create(fingerprint, rawText);
        String queryId = record.getId();
        
        try {
            resultStore.markInFlight(queryId);
            
            ReasoningRequest request = ReasoningRequest.builder()
                .text(rawText)
                .contextDocuments(billService.contextDocuments(fingerprint.getSortedRefs()))
                .build();
            
            log.info("[QUERY_ORCH] Invoking reasoning service | queryId={} | fingerprint={} | contextDocuments={}",
                queryId, fingerprint.shortValue(), request.getContextDocuments().size());
            
            ReasoningResult result = reasoningAdapter.invoke(request);
            log.info("[QUERY_ORCH] Reasoning completed | queryId={} | model={} | attempts={} | latencyMs={}",
                queryId, result.getModel(), result.getAttempts(), result.getLatencyMs());
            return CallResult.produced(resultStore.complete(queryId, result));
        } catch (ExternalServiceException e) {
            log.warn("[QUERY_ORCH] Reasoning failed | queryId={} | kind={} | attempts={} | error={}",
                queryId, e.getKind(), e.getAttempts(), e.getMessage());
            return CallResult.produced(
                resultStore.fail(queryId, new ErrorInfo(e.getKind(), e.getMessage()), e.getAttempts()));
        } catch (StorageException e) {
            log.error("[QUERY_ORCH] Storage failed during execution | queryId={} | error={}", queryId, e.getMessage(), e);
            recordAbort(queryId, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("[QUERY_ORCH] Query execution aborted | queryId={} | error={}", queryId, e.getMessage(), e);
            return CallResult.produced(recordAbort(queryId, e));
        }
    }
    
    /**
     * Marks the query failed with {@code SERVER_ERROR}. If even that write fails, {@code cause} is rethrown.
     */
    private QueryRecord recordAbort(String queryId, RuntimeException cause) {
        try {
            return resultStore.fail(queryId,
                new ErrorInfo(ErrorKind.SERVER_ERROR, "Query execution aborted: " + cause.getMessage()), 0);
        } catch (RuntimeException e) {
            log.error("[QUERY_ORCH] Could not mark aborted query failed | queryId={} | error={}", queryId, e.getMessage());
            cause.addSuppressed(e);
            throw cause;
        }
    }
}
