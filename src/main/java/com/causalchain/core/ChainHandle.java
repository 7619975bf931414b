package com.causalchain.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Addresses one chain explicitly. Flows that hold a handle never depend on
 * the tracker's active-chain slot, so several of them can record at the
 * same time without their events being mixed up.
 */
public final class ChainHandle {

    private final CausalityTracker tracker;
    private final String chainId;

    ChainHandle(CausalityTracker tracker, String chainId) {
        this.tracker = tracker;
        this.chainId = chainId;
    }

    public String getChainId() {
        return chainId;
    }

    public String addEvent(CausalEventType type, String description) {
        return tracker.addEvent(type, description, null, null, chainId, null);
    }

    public String addEvent(CausalEventType type, String description, Map<String, Object> context,
                           EventDetails details) {
        return tracker.addEvent(type, description, context, details, chainId, null);
    }

    public String addEvent(CausalEventType type, String description, Map<String, Object> context,
                           EventDetails details, String parentEventId) {
        return tracker.addEvent(type, description, context, details, chainId, parentEventId);
    }

    public void completeEvent(String eventId) {
        tracker.completeEvent(eventId);
    }

    public void completeEvent(String eventId, Throwable error) {
        tracker.completeEvent(eventId, error);
    }

    public void end() {
        tracker.endChain(chainId);
    }

    public Optional<CausalityChain> snapshot() {
        return tracker.getChain(chainId);
    }

    public Map<String, Object> causalityContext() {
        return tracker.getCausalityContext(chainId);
    }

    public <T, R> Function<T, CompletableFuture<R>> withCausality(Function<T, CompletableFuture<R>> fn,
                                                                   CausalEventType type, String description,
                                                                   Map<String, Object> context) {
        return tracker.withCausality(fn, type, description, context, chainId);
    }

    public <V> Callable<V> withCausality(Callable<V> task, CausalEventType type, String description,
                                         Map<String, Object> context) {
        return tracker.withCausality(task, type, description, context, chainId);
    }

    @Override
    public String toString() {
        return "ChainHandle{" + chainId + "}";
    }
}
