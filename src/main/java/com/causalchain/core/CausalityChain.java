package com.causalchain.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered collection of causally related events sharing one root cause.
 * The chain owns its events; {@link #getEvents()} is in insertion order.
 */
public class CausalityChain {

    private final String id;
    private final CausalEvent rootCause;
    private final List<CausalEvent> events;
    private final ChainMetadata metadata;

    CausalityChain(String id, CausalEvent rootCause, List<String> tags) {
        this.id = id;
        this.rootCause = rootCause;
        this.events = new ArrayList<>();
        this.events.add(rootCause);
        this.metadata = new ChainMetadata(rootCause.getTiming().getStartTime(), tags);
    }

    private CausalityChain(CausalityChain other) {
        this.id = other.id;
        this.events = new ArrayList<>(other.events.size());
        for (CausalEvent event : other.events) {
            this.events.add(event.copy());
        }
        this.rootCause = this.events.get(0);
        this.metadata = new ChainMetadata(other.metadata);
    }

    /**
     * Deep copy detached from the live store.
     */
    CausalityChain snapshot() {
        return new CausalityChain(this);
    }

    void append(CausalEvent event) {
        events.add(event);
        metadata.recordAppend(events.size(), event.getMetadata().getDepth());
    }

    CausalEvent lastEvent() {
        return events.get(events.size() - 1);
    }

    List<CausalEvent> liveEvents() {
        return events;
    }

    public String getId() { return id; }
    public CausalEvent getRootCause() { return rootCause; }
    public List<CausalEvent> getEvents() { return Collections.unmodifiableList(events); }
    public ChainMetadata getMetadata() { return metadata; }

    public boolean hasError() {
        for (CausalEvent event : events) {
            if (event.getMetadata().hasError()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "CausalityChain{" +
                "id='" + id + '\'' +
                ", rootCause='" + rootCause.getDescription() + '\'' +
                ", eventCount=" + metadata.getEventCount() +
                ", maxDepth=" + metadata.getMaxDepth() +
                '}';
    }
}
