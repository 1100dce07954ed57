package com.healthecon.core.inflight;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Registry entry for one fingerprint: the shared outcome plus the callers waiting on it.
 * The monitor of this object is the per-fingerprint critical section.
 */
final class InflightCall {
    
    private final String fingerprint;
    private final Instant startedAt;
    private final CompletableFuture<CallResult> shared = new CompletableFuture<>();
    private final Deque<InflightHandle> waiters = new ArrayDeque<>();
    private final InflightCoordinator coordinator;
    
    InflightCall(String fingerprint, Instant startedAt, InflightCoordinator coordinator) {
        this.fingerprint = fingerprint;
        this.startedAt = startedAt;
        this.coordinator = coordinator;
    }
    
    String getFingerprint() {
        return fingerprint;
    }
    
    Instant getStartedAt() {
        return startedAt;
    }
    
    synchronized InflightHandle addWaiter() {
        // An orphaned call (every waiter abandoned) hands leadership to whoever joins next
        InflightHandle handle = new InflightHandle(fingerprint, waiters.isEmpty());
        waiters.addLast(handle);
        shared.whenComplete(handle::deliver);
        handle.outcome().whenComplete((result, error) -> {
            if (InflightHandle.isCancellation(error)) {
                removeWaiter(handle);
            }
        });
        return handle;
    }
    
    synchronized int waiterCount() {
        return waiters.size();
    }
    
    void resolve(CallResult result, Throwable error) {
        synchronized (this) {
            waiters.clear();
        }
        if (error != null) {
            shared.completeExceptionally(error);
        } else {
            shared.complete(result);
        }
    }
    
    private void removeWaiter(InflightHandle handle) {
        InflightHandle promoted = null;
        int remaining;
        synchronized (this) {
            boolean removed = waiters.remove(handle);
            if (removed && handle.isLeader() && !waiters.isEmpty()) {
                promoted = waiters.peekFirst();
                promoted.promote();
            }
            remaining = waiters.size();
        }
        coordinator.onAbandoned(this, handle, promoted, remaining);
    }
}
