package com.causalchain;

import com.causalchain.core.CausalEventType;
import com.causalchain.core.CausalityTracker;
import com.causalchain.core.EventDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Static entry points backed by one process-wide {@link CausalityTracker}.
 *
 * <p>Failures inside the tracker are logged and never reach the caller:
 * recording causality must not break the operation being recorded. The
 * only exception that escapes is the one thrown by an operation wrapped
 * with {@code withCausality}.
 */
public final class Causality {

    private static final Logger LOG = LoggerFactory.getLogger(Causality.class);

    private static final Object LOCK = new Object();
    private static volatile CausalityTracker tracker;
    private static boolean ownsTracker = false;
    private static boolean shutdownHookRegistered = false;

    private Causality() {
    }

    /**
     * The shared tracker, created with default options on first use.
     */
    public static CausalityTracker tracker() {
        CausalityTracker current = tracker;
        if (current != null) {
            return current;
        }
        synchronized (LOCK) {
            if (tracker == null) {
                tracker = new CausalityTracker();
                ownsTracker = true;
                registerShutdownHook();
            }
            return tracker;
        }
    }

    /**
     * Replaces the shared tracker. A default tracker created by
     * {@link #tracker()} is destroyed; a previously installed one is left to
     * its owner.
     */
    public static void install(CausalityTracker replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        CausalityTracker ownedPrevious = null;
        synchronized (LOCK) {
            if (ownsTracker && tracker != replacement) {
                ownedPrevious = tracker;
            }
            tracker = replacement;
            ownsTracker = false;
            registerShutdownHook();
        }
        if (ownedPrevious != null) {
            ownedPrevious.destroy();
        }
    }

    public static String startCausalChain(CausalEventType type, String description) {
        return startCausalChain(type, description, null, null);
    }

    /**
     * @return the new chain id, or null if the chain could not be recorded
     */
    public static String startCausalChain(CausalEventType type, String description,
                                          Map<String, Object> context, EventDetails details) {
        try {
            return tracker().startChain(type, description, context, details);
        } catch (RuntimeException e) {
            LOG.warn("Failed to start causal chain '{}': {}", description, e.getMessage());
            return null;
        }
    }

    public static String addCausalEvent(CausalEventType type, String description) {
        return addCausalEvent(type, description, null, null);
    }

    /**
     * Adds an event to the active chain, starting one if none is active.
     *
     * @return the new event id, or null if the event could not be recorded
     */
    public static String addCausalEvent(CausalEventType type, String description,
                                        Map<String, Object> context, EventDetails details) {
        try {
            return tracker().addEvent(type, description, context, details);
        } catch (RuntimeException e) {
            LOG.warn("Failed to add causal event '{}': {}", description, e.getMessage());
            return null;
        }
    }

    public static void completeCausalEvent(String eventId) {
        completeCausalEvent(eventId, null);
    }

    public static void completeCausalEvent(String eventId, Throwable error) {
        try {
            tracker().completeEvent(eventId, error);
        } catch (RuntimeException e) {
            LOG.warn("Failed to complete causal event {}: {}", eventId, e.getMessage());
        }
    }

    public static void endCurrentChain() {
        try {
            CausalityTracker current = tracker();
            current.getCurrentChainId().ifPresent(current::endChain);
        } catch (RuntimeException e) {
            LOG.warn("Failed to end current causal chain: {}", e.getMessage());
        }
    }

    public static Map<String, Object> getCausalityLogContext() {
        try {
            return tracker().getCausalityContext();
        } catch (RuntimeException e) {
            LOG.warn("Failed to read causality context: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    public static <T, R> Function<T, CompletableFuture<R>> withCausality(Function<T, CompletableFuture<R>> fn,
                                                                          CausalEventType type, String description) {
        return withCausality(fn, type, description, null);
    }

    /**
     * Records every invocation of {@code fn} as an event on the active chain.
     * The tracker is resolved at call time, so a tracker installed later is
     * picked up by functions wrapped earlier.
     */
    public static <T, R> Function<T, CompletableFuture<R>> withCausality(Function<T, CompletableFuture<R>> fn,
                                                                          CausalEventType type, String description,
                                                                          Map<String, Object> context) {
        return arg -> tracker().withCausality(fn, type, description, context).apply(arg);
    }

    public static <V> Callable<V> withCausality(Callable<V> task, CausalEventType type, String description,
                                                Map<String, Object> context) {
        return () -> tracker().withCausality(task, type, description, context).call();
    }

    private static void registerShutdownHook() {
        if (shutdownHookRegistered) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            CausalityTracker current = tracker;
            if (current != null) {
                current.destroy();
            }
        }, "causality-shutdown"));
        shutdownHookRegistered = true;
    }
}
