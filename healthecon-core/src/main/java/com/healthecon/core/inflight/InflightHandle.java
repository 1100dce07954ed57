package com.healthecon.core.inflight;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * One caller's membership in an in-flight call. The outcome future belongs to this caller alone:
 * cancelling it abandons the wait without touching the shared call or the other waiters.
 */
public class InflightHandle {
    
    private final String fingerprint;
    private final CompletableFuture<CallResult> outcome = new CompletableFuture<>();
    private volatile boolean leader;
    
    InflightHandle(String fingerprint, boolean leader) {
        this.fingerprint = fingerprint;
        this.leader = leader;
    }
    
    public String getFingerprint() {
        return fingerprint;
    }
    
    public boolean isLeader() {
        return leader;
    }
    
    void promote() {
        this.leader = true;
    }
    
    public CompletableFuture<CallResult> outcome() {
        return outcome;
    }
    
    /**
     * Blocks until the shared call resolves. Failures of the call are rethrown unwrapped.
     */
    public CallResult await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CompletionException(cause);
        }
    }
    
    /**
     * Stops waiting. Returns false if the outcome had already been delivered.
     */
    public boolean abandon() {
        return outcome.cancel(false);
    }
    
    public boolean isAbandoned() {
        return outcome.isCancelled();
    }
    
    void deliver(CallResult result, Throwable error) {
        if (error != null) {
            outcome.completeExceptionally(error);
        } else {
            outcome.complete(result);
        }
    }
    
    static boolean isCancellation(Throwable error) {
        return error instanceof CancellationException;
    }
}
