package com.causalchain.core;

import com.causalchain.logging.CausalityMdc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Records cause-and-effect chains of events in a bounded, volatile store.
 *
 * <p>Chains are started with {@link #startChain} (which also makes the new
 * chain the active one) or {@link #openChain} (which returns a
 * {@link ChainHandle} and leaves the active slot alone). Calls that omit a
 * chain id are attributed to the active chain, so unrelated flows running
 * at the same time must use handles or explicit ids.
 *
 * <p>A background sweep expires chains older than
 * {@link CausalityOptions#getMaxChainDuration()} and then evicts the oldest
 * chains by start time until at most
 * {@link CausalityOptions#getMaxChainsInMemory()} remain.
 *
 * <p>All mutations take the write lock; queries take the read lock and
 * return deep copies.
 */
public class CausalityTracker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CausalityTracker.class);

    private static final double SOFT_CAPACITY_FACTOR = 1.2;

    public static final String CONTEXT_CHAIN_ID = "causalityChainId";
    public static final String CONTEXT_EVENT_ID = "causalityEventId";
    public static final String CONTEXT_DEPTH = "causalityDepth";
    public static final String CONTEXT_ROOT_CAUSE = "causalityRootCause";
    public static final String CONTEXT_EVENT_COUNT = "causalityEventCount";
    public static final String CONTEXT_CHAIN_DURATION = "causalityChainDuration";

    private final Map<String, CausalityChain> chains = new LinkedHashMap<>();
    private final Map<String, CausalEvent> events = new HashMap<>();
    private String activeChainId;

    private final CausalityOptions options;
    private final Clock clock;
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final AtomicReference<ScheduledExecutorService> cleanupScheduler = new AtomicReference<>();

    private long totalChainsStarted = 0;
    private long totalEventsRecorded = 0;
    private long totalChainsExpired = 0;
    private long totalChainsEvicted = 0;

    public static class ChainNotFoundException extends RuntimeException {
        private final String chainId;

        public ChainNotFoundException(String chainId) {
            super("Chain " + chainId + " not found");
            this.chainId = chainId;
        }

        public String getChainId() {
            return chainId;
        }
    }

    public CausalityTracker(CausalityOptions options, Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(clock, "clock");

        if (!options.getCleanupInterval().isZero()) {
            long periodMs = Math.max(1L, options.getCleanupInterval().toMillis());
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "causality-cleanup");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::runScheduledCleanup, periodMs, periodMs, TimeUnit.MILLISECONDS);
            cleanupScheduler.set(scheduler);
        }

        LOG.info("Causality tracker initialized: {}", options);
    }

    public CausalityTracker(CausalityOptions options) {
        this(options, Clock.systemUTC());
    }

    public CausalityTracker() {
        this(CausalityOptions.defaults());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public String startChain(CausalEventType type, String description) {
        return startChain(type, description, null, null);
    }

    /**
     * Starts a new chain with a root event at depth 0 and makes it the
     * active chain.
     *
     * @return the new chain id
     */
    public String startChain(CausalEventType type, String description,
                             Map<String, Object> context, EventDetails details) {
        rwLock.writeLock().lock();
        try {
            return createChainLocked(type, description, context, details, true).getId();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Starts a new chain without touching the active slot and returns a
     * handle that always addresses it explicitly.
     */
    public ChainHandle openChain(CausalEventType type, String description,
                                 Map<String, Object> context, EventDetails details) {
        rwLock.writeLock().lock();
        try {
            return new ChainHandle(this, createChainLocked(type, description, context, details, false).getId());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public ChainHandle openChain(CausalEventType type, String description) {
        return openChain(type, description, null, null);
    }

    /**
     * Handle for an existing chain.
     *
     * @throws ChainNotFoundException if the chain is not in the store
     */
    public ChainHandle handle(String chainId) {
        rwLock.readLock().lock();
        try {
            if (!chains.containsKey(chainId)) {
                throw new ChainNotFoundException(chainId);
            }
            return new ChainHandle(this, chainId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public String addEvent(CausalEventType type, String description) {
        return addEvent(type, description, null, null, null, null);
    }

    public String addEvent(CausalEventType type, String description,
                           Map<String, Object> context, EventDetails details) {
        return addEvent(type, description, context, details, null, null);
    }

    /**
     * Appends an event to a chain.
     *
     * <p>Without a {@code chainId} the event goes to the active chain; when
     * no chain is active a new chain is started and the id of its root event
     * is returned. Without a {@code parentEventId} the parent is the last
     * event appended to the chain.
     *
     * @return the new event id
     * @throws ChainNotFoundException if {@code chainId} is given but unknown
     */
    public String addEvent(CausalEventType type, String description, Map<String, Object> context,
                           EventDetails details, String chainId, String parentEventId) {
        requireType(type);

        rwLock.writeLock().lock();
        try {
            String targetChainId = chainId;
            if (targetChainId == null) {
                if (activeChainId != null && !chains.containsKey(activeChainId)) {
                    LOG.debug("Active chain {} was removed by cleanup, starting a new chain", activeChainId);
                    activeChainId = null;
                }
                targetChainId = activeChainId;
            }
            if (targetChainId == null) {
                return createChainLocked(type, description, context, details, true).getRootCause().getId();
            }

            CausalityChain chain = chains.get(targetChainId);
            if (chain == null) {
                throw new ChainNotFoundException(targetChainId);
            }

            CausalEvent parent = resolveParentLocked(chain, parentEventId);
            String eventId = generateId("event");
            CausalEvent event = new CausalEvent(eventId, chain.getId(), parent.getId(), type, description,
                    clock.millis(), context, parent.getMetadata().getDepth() + 1, details);

            parent.addChild(eventId);
            chain.append(event);
            events.put(eventId, event);
            totalEventsRecorded++;

            if (chain.liveEvents().size() >= options.getMaxChainLength()) {
                LOG.debug("Chain {} reached {} events, ending it", chain.getId(), options.getMaxChainLength());
                endChainLocked(chain);
            }
            return eventId;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public void completeEvent(String eventId) {
        completeEvent(eventId, null);
    }

    /**
     * Records the end of an event. With an error the failure is attached to
     * the event and its severity raised to {@link Severity#HIGH}. Unknown ids
     * (including events whose chain was already evicted) are ignored.
     */
    public void completeEvent(String eventId, Throwable error) {
        completeEventWithError(eventId, error != null ? RecordedError.of(error) : null);
    }

    /**
     * Same as {@link #completeEvent(String, Throwable)} for a failure that is
     * already in recorded form.
     */
    public void completeEventWithError(String eventId, RecordedError error) {
        if (eventId == null) {
            return;
        }
        rwLock.writeLock().lock();
        try {
            CausalEvent event = events.get(eventId);
            if (event == null) {
                LOG.debug("Ignoring completion of unknown event {}", eventId);
                return;
            }
            event.getTiming().complete(clock.millis());
            if (error != null) {
                event.getMetadata().recordError(error);
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Closes a chain, recording its total duration. Clears the active slot
     * when it pointed at this chain. Unknown ids are ignored.
     */
    public void endChain(String chainId) {
        if (chainId == null) {
            return;
        }
        rwLock.writeLock().lock();
        try {
            CausalityChain chain = chains.get(chainId);
            if (chain == null) {
                return;
            }
            endChainLocked(chain);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Optional<String> getCurrentChainId() {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(activeChainId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<CausalityChain> getChain(String chainId) {
        rwLock.readLock().lock();
        try {
            CausalityChain chain = chains.get(chainId);
            return chain != null ? Optional.of(chain.snapshot()) : Optional.empty();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public Optional<CausalEvent> getEvent(String eventId) {
        rwLock.readLock().lock();
        try {
            CausalEvent event = events.get(eventId);
            return event != null ? Optional.of(event.copy()) : Optional.empty();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public List<CausalityChain> getChains() {
        return getChains(null);
    }

    /**
     * Snapshots of the chains matching {@code filter}, in the order they
     * were started. A null filter returns every chain.
     */
    public List<CausalityChain> getChains(ChainFilter filter) {
        rwLock.readLock().lock();
        try {
            List<CausalityChain> result = new ArrayList<>();
            for (CausalityChain chain : chains.values()) {
                if (filter == null || filter.matches(chain)) {
                    result.add(chain.snapshot());
                }
            }
            return result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public List<TimelineEntry> getChainTimeline(String chainId) {
        return getChain(chainId).map(ChainAnalyzer::timeline).orElse(Collections.emptyList());
    }

    public PerformanceImpact getChainPerformanceImpact(String chainId) {
        return getChain(chainId).map(ChainAnalyzer::performance).orElse(PerformanceImpact.empty());
    }

    /**
     * Chain, timeline and performance built from a single snapshot; empty
     * when the chain is unknown.
     */
    public Optional<ChainExport> exportChain(String chainId) {
        return getChain(chainId).map(ChainAnalyzer::export);
    }

    /**
     * Ids from the root cause down to {@code eventId}, inclusive. Empty if
     * the event is unknown.
     */
    public List<String> getCausalAncestry(String eventId) {
        rwLock.readLock().lock();
        try {
            LinkedList<String> path = new LinkedList<>();
            CausalEvent current = events.get(eventId);
            while (current != null) {
                path.addFirst(current.getId());
                current = current.getParentId() != null ? events.get(current.getParentId()) : null;
            }
            return new ArrayList<>(path);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * {@code eventId} followed by every event it transitively caused, in
     * breadth-first order. Empty if the event is unknown.
     */
    public List<String> getCausalDescendants(String eventId) {
        rwLock.readLock().lock();
        try {
            if (!events.containsKey(eventId)) {
                return Collections.emptyList();
            }
            List<String> result = new ArrayList<>();
            Deque<String> frontier = new ArrayDeque<>();
            frontier.add(eventId);
            while (!frontier.isEmpty()) {
                String currentId = frontier.poll();
                CausalEvent current = events.get(currentId);
                if (current == null) {
                    continue;
                }
                result.add(currentId);
                frontier.addAll(current.getChildIds());
            }
            return result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * Flat context of the active chain's last event, for structured logs.
     * Empty when no chain is active.
     */
    public Map<String, Object> getCausalityContext() {
        rwLock.readLock().lock();
        try {
            return activeChainId != null ? contextLocked(activeChainId) : new LinkedHashMap<>();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * Same as {@link #getCausalityContext()} for a specific chain.
     */
    public Map<String, Object> getCausalityContext(String chainId) {
        rwLock.readLock().lock();
        try {
            return contextLocked(chainId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int getChainCount() {
        rwLock.readLock().lock();
        try {
            return chains.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int getEventCount() {
        rwLock.readLock().lock();
        try {
            return events.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public CausalityOptions getOptions() {
        return options;
    }

    public String getStats() {
        rwLock.readLock().lock();
        try {
            return String.format("CausalityTracker[chains=%d, events=%d, activeChain=%s, chainsStarted=%d, " +
                            "eventsRecorded=%d, chainsExpired=%d, chainsEvicted=%d, cleanupScheduled=%b]",
                    chains.size(), events.size(), activeChainId, totalChainsStarted, totalEventsRecorded,
                    totalChainsExpired, totalChainsEvicted, cleanupScheduler.get() != null);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Wrapping
    // ------------------------------------------------------------------

    /**
     * Wraps an asynchronous operation so each invocation is recorded as an
     * event on the active chain, completed when the returned future settles.
     * A function that returns null instead of a future yields a future failed
     * with {@link IllegalStateException}, recorded on the event.
     */
    public <T, R> Function<T, CompletableFuture<R>> withCausality(Function<T, CompletableFuture<R>> fn,
                                                                   CausalEventType type, String description,
                                                                   Map<String, Object> context) {
        return withCausality(fn, type, description, context, null);
    }

    /**
     * Wraps a synchronous task so each call is recorded as an event on the
     * active chain. The task's exception is recorded and rethrown.
     */
    public <V> Callable<V> withCausality(Callable<V> task, CausalEventType type, String description,
                                         Map<String, Object> context) {
        return withCausality(task, type, description, context, null);
    }

    <T, R> Function<T, CompletableFuture<R>> withCausality(Function<T, CompletableFuture<R>> fn,
                                                            CausalEventType type, String description,
                                                            Map<String, Object> context, String chainId) {
        Objects.requireNonNull(fn, "fn");
        return arg -> {
            String eventId = tryAddEvent(type, description, context, chainId);
            CompletableFuture<R> future;
            try (CausalityMdc.Scope ignored = bindContext(eventId)) {
                future = fn.apply(arg);
            } catch (RuntimeException | Error e) {
                completeEvent(eventId, e);
                throw e;
            }
            if (future == null) {
                IllegalStateException missing = new IllegalStateException(
                        "wrapped function '" + description + "' returned null instead of a future");
                completeEvent(eventId, missing);
                return CompletableFuture.failedFuture(missing);
            }
            if (eventId == null) {
                return future;
            }
            return future.whenComplete((result, error) -> {
                if (error == null) {
                    completeEvent(eventId);
                } else {
                    completeEvent(eventId, unwrap(error));
                }
            });
        };
    }

    <V> Callable<V> withCausality(Callable<V> task, CausalEventType type, String description,
                                  Map<String, Object> context, String chainId) {
        Objects.requireNonNull(task, "task");
        return () -> {
            String eventId = tryAddEvent(type, description, context, chainId);
            try (CausalityMdc.Scope ignored = bindContext(eventId)) {
                V result = task.call();
                completeEvent(eventId);
                return result;
            } catch (Exception e) {
                completeEvent(eventId, e);
                throw e;
            } catch (Error e) {
                completeEvent(eventId, e);
                throw e;
            }
        };
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    /**
     * Removes chains older than the maximum chain duration, then evicts the
     * oldest chains by start time until the store is within its capacity.
     */
    public void cleanup() {
        rwLock.writeLock().lock();
        try {
            cleanupLocked();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Drops every chain and event. The cleanup schedule keeps running.
     */
    public void clear() {
        rwLock.writeLock().lock();
        try {
            chains.clear();
            events.clear();
            activeChainId = null;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * Stops the cleanup schedule and clears all state. Safe to call more
     * than once.
     */
    public void destroy() {
        ScheduledExecutorService scheduler = cleanupScheduler.getAndSet(null);
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while stopping causality cleanup", e);
            }
            LOG.info("Causality tracker destroyed: {}", getStats());
        }
        clear();
    }

    @Override
    public void close() {
        destroy();
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private CausalityChain createChainLocked(CausalEventType type, String description, Map<String, Object> context,
                                             EventDetails details, boolean activate) {
        requireType(type);
        EventDetails effective = details != null ? details : EventDetails.none();

        String chainId = generateId("chain");
        String eventId = generateId("event");
        CausalEvent rootEvent = new CausalEvent(eventId, chainId, null, type, description,
                clock.millis(), context, 0, effective);
        CausalityChain chain = new CausalityChain(chainId, rootEvent, effective.getTags());

        chains.put(chainId, chain);
        events.put(eventId, rootEvent);
        if (activate) {
            activeChainId = chainId;
        }
        totalChainsStarted++;
        totalEventsRecorded++;
        LOG.debug("Started chain {} with root {} '{}'", chainId, type.wireName(), description);

        cleanupIfNeededLocked();
        return chain;
    }

    private CausalEvent resolveParentLocked(CausalityChain chain, String parentEventId) {
        if (parentEventId != null) {
            CausalEvent parent = events.get(parentEventId);
            if (parent != null && parent.getChainId().equals(chain.getId())) {
                return parent;
            }
            LOG.warn("Parent event {} is not part of chain {}, attaching to the chain's latest event instead",
                    parentEventId, chain.getId());
        }
        return chain.lastEvent();
    }

    private void endChainLocked(CausalityChain chain) {
        chain.getMetadata().end(clock.millis());
        if (chain.getId().equals(activeChainId)) {
            activeChainId = null;
        }
        LOG.debug("Ended chain {} after {} ms with {} events", chain.getId(),
                chain.getMetadata().getTotalDuration(), chain.getMetadata().getEventCount());
    }

    private Map<String, Object> contextLocked(String chainId) {
        Map<String, Object> context = new LinkedHashMap<>();
        CausalityChain chain = chainId != null ? chains.get(chainId) : null;
        if (chain == null) {
            return context;
        }
        CausalEvent lastEvent = chain.lastEvent();
        context.put(CONTEXT_CHAIN_ID, chain.getId());
        context.put(CONTEXT_EVENT_ID, lastEvent.getId());
        context.put(CONTEXT_DEPTH, lastEvent.getMetadata().getDepth());
        context.put(CONTEXT_ROOT_CAUSE, chain.getRootCause().getDescription());
        context.put(CONTEXT_EVENT_COUNT, chain.getMetadata().getEventCount());
        context.put(CONTEXT_CHAIN_DURATION, Math.max(0L, clock.millis() - chain.getMetadata().getStartTime()));
        return context;
    }

    private void cleanupIfNeededLocked() {
        if (chains.size() > options.getMaxChainsInMemory() * SOFT_CAPACITY_FACTOR) {
            cleanupLocked();
        }
    }

    private void cleanupLocked() {
        long now = clock.millis();
        long maxAgeMs = options.getMaxChainDuration().toMillis();

        List<String> expired = new ArrayList<>();
        for (CausalityChain chain : chains.values()) {
            if (now - chain.getMetadata().getStartTime() > maxAgeMs) {
                expired.add(chain.getId());
            }
        }
        for (String chainId : expired) {
            removeChainLocked(chainId);
        }

        int overflow = chains.size() - options.getMaxChainsInMemory();
        if (overflow > 0) {
            // FIFO by creation time, not by last activity
            List<CausalityChain> oldestFirst = new ArrayList<>(chains.values());
            oldestFirst.sort(Comparator.comparingLong(c -> c.getMetadata().getStartTime()));
            for (int i = 0; i < overflow; i++) {
                removeChainLocked(oldestFirst.get(i).getId());
            }
        }

        int evicted = Math.max(overflow, 0);
        totalChainsExpired += expired.size();
        totalChainsEvicted += evicted;
        if (!expired.isEmpty() || evicted > 0) {
            LOG.info("Causality cleanup expired {} and evicted {} chains, {} remain",
                    expired.size(), evicted, chains.size());
        }
    }

    private void removeChainLocked(String chainId) {
        CausalityChain chain = chains.remove(chainId);
        if (chain == null) {
            return;
        }
        for (CausalEvent event : chain.liveEvents()) {
            events.remove(event.getId());
        }
        if (chainId.equals(activeChainId)) {
            activeChainId = null;
        }
    }

    private void runScheduledCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            LOG.error("Scheduled causality cleanup failed", e);
        }
    }

    private String tryAddEvent(CausalEventType type, String description, Map<String, Object> context, String chainId) {
        try {
            return addEvent(type, description, context, null, chainId, null);
        } catch (RuntimeException e) {
            LOG.warn("Could not record '{}', running it untracked: {}", description, e.getMessage());
            return null;
        }
    }

    /**
     * Binds the context of the chain with the event and depth of
     * {@code eventId} itself, which is not necessarily the chain's last
     * event once other flows append to the same chain.
     */
    private CausalityMdc.Scope bindContext(String eventId) {
        if (eventId == null) {
            return CausalityMdc.Scope.NOOP;
        }
        Map<String, Object> context;
        rwLock.readLock().lock();
        try {
            CausalEvent event = events.get(eventId);
            if (event == null) {
                return CausalityMdc.Scope.NOOP;
            }
            context = contextLocked(event.getChainId());
            context.put(CONTEXT_EVENT_ID, event.getId());
            context.put(CONTEXT_DEPTH, event.getMetadata().getDepth());
        } finally {
            rwLock.readLock().unlock();
        }
        return CausalityMdc.bind(context);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static void requireType(CausalEventType type) {
        if (type == null) {
            throw new IllegalArgumentException("event type cannot be null");
        }
    }

    private static String generateId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }
}
