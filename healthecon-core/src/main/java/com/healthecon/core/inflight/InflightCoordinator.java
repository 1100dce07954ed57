package com.healthecon.core.inflight;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Single-flight registry keyed by query fingerprint.
 * The first caller for a fingerprint launches the work, later callers share its outcome.
 */
@Component
@Slf4j
public class InflightCoordinator {
    
    private final ConcurrentHashMap<String, InflightCall> calls = new ConcurrentHashMap<>();
    private final Executor executor;
    private final Clock clock;
    
    private final AtomicLong leaders = new AtomicLong();
    private final AtomicLong followers = new AtomicLong();
    private final AtomicLong promotions = new AtomicLong();
    private final AtomicLong abandonedWaits = new AtomicLong();
    private final AtomicLong resolved = new AtomicLong();
    
    public InflightCoordinator(@Qualifier("inflightExecutor") Executor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }
    
    /**
     * Joins the call for the fingerprint, launching {@code work} if no call is running yet.
     * The work runs on the engine executor and is never cancelled by waiters leaving.
     */
    public InflightHandle join(String fingerprint, Supplier<CallResult> work) {
        AtomicBoolean created = new AtomicBoolean();
        AtomicReference<InflightHandle> joined = new AtomicReference<>();
        
        InflightCall call = calls.compute(fingerprint, (key, existing) -> {
            InflightCall target = existing;
            if (target == null) {
                target = new InflightCall(key, clock.instant(), this);
                created.set(true);
            }
            joined.set(target.addWaiter());
            return target;
        });
        
        InflightHandle handle = joined.get();
        if (created.get()) {
            leaders.incrementAndGet();
            log.info("[INFLIGHT] Leader launched | fingerprint={} | inflight={}",
                abbreviate(fingerprint), calls.size());
            launch(call, work);
        } else {
            followers.incrementAndGet();
            log.info("[INFLIGHT] Follower joined | fingerprint={} | leader={} | waiters={}",
                abbreviate(fingerprint), handle.isLeader(), call.waiterCount());
        }
        return handle;
    }
    
    private void launch(InflightCall call, Supplier<CallResult> work) {
        try {
            CompletableFuture.supplyAsync(work, executor)
                .whenComplete((result, error) -> resolve(call, result, error));
        } catch (RejectedExecutionException e) {
            log.error("[INFLIGHT] Executor rejected work | fingerprint={} | error={}",
                abbreviate(call.getFingerprint()), e.getMessage());
            resolve(call, null, e);
        }
    }
    
    private void resolve(InflightCall call, CallResult result, Throwable error) {
        // Unregister first so no caller can join a call whose outcome is already known
        calls.remove(call.getFingerprint(), call);
        resolved.incrementAndGet();
        long durationMs = Duration.between(call.getStartedAt(), clock.instant()).toMillis();
        
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error;
        if (cause != null) {
            log.warn("[INFLIGHT] Call resolved exceptionally | fingerprint={} | durationMs={} | error={}",
                abbreviate(call.getFingerprint()), durationMs, cause.getMessage());
        } else {
            log.info("[INFLIGHT] Call resolved | fingerprint={} | durationMs={} | queryId={} | status={} | reused={}",
                abbreviate(call.getFingerprint()), durationMs,
                result != null ? result.getQuery().getId() : null,
                result != null ? result.getQuery().getStatus() : null,
                result != null && result.isReused());
        }
        call.resolve(result, cause);
    }
    
    void onAbandoned(InflightCall call, InflightHandle handle, InflightHandle promoted, int remaining) {
        abandonedWaits.incrementAndGet();
        log.info("[INFLIGHT] Wait abandoned | fingerprint={} | wasLeader={} | remainingWaiters={}",
            abbreviate(call.getFingerprint()), handle.isLeader(), remaining);
        if (promoted != null) {
            promotions.incrementAndGet();
            log.info("[INFLIGHT] Follower promoted to leader | fingerprint={}", abbreviate(call.getFingerprint()));
        }
    }
    
    public boolean isInflight(String fingerprint) {
        return calls.containsKey(fingerprint);
    }
    
    public int waiterCount(String fingerprint) {
        InflightCall call = calls.get(fingerprint);
        return call == null ? 0 : call.waiterCount();
    }
    
    public int inflightCount() {
        return calls.size();
    }
    
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("inflight", calls.size());
        stats.put("leaders", leaders.get());
        stats.put("followers", followers.get());
        stats.put("promotions", promotions.get());
        stats.put("abandonedWaits", abandonedWaits.get());
        stats.put("resolved", resolved.get());
        return stats;
    }
    
    private static String abbreviate(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
