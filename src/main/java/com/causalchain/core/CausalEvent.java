package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single recorded occurrence inside a chain. Parent and child links are
 * event ids scoped to the owning chain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CausalEvent {

    public static final String CONTEXT_COMPONENT = "component";
    public static final String CONTEXT_WINDOW_ID = "windowId";
    public static final String CONTEXT_APP_ID = "appId";
    public static final String CONTEXT_USER_ID = "userId";

    private final String id;
    private final String chainId;
    private final String parentId;
    private final List<String> childIds;
    private final CausalEventType type;
    private final String description;
    private final EventTiming timing;
    private final Map<String, Object> context;
    private final EventMetadata metadata;

    CausalEvent(String id, String chainId, String parentId, CausalEventType type, String description,
                long startTime, Map<String, Object> context, int depth, EventDetails details) {
        this.id = id;
        this.chainId = chainId;
        this.parentId = parentId;
        this.childIds = new ArrayList<>();
        this.type = type;
        this.description = description;
        this.timing = new EventTiming(startTime);
        this.context = new LinkedHashMap<>(context != null ? context : Collections.emptyMap());
        this.metadata = new EventMetadata(depth, details != null ? details : EventDetails.none());
    }

    private CausalEvent(CausalEvent other) {
        this.id = other.id;
        this.chainId = other.chainId;
        this.parentId = other.parentId;
        this.childIds = new ArrayList<>(other.childIds);
        this.type = other.type;
        this.description = other.description;
        this.timing = new EventTiming(other.timing);
        this.context = new LinkedHashMap<>(other.context);
        this.metadata = new EventMetadata(other.metadata);
    }

    CausalEvent copy() {
        return new CausalEvent(this);
    }

    void addChild(String childId) {
        childIds.add(childId);
    }

    public String getId() { return id; }
    public String getChainId() { return chainId; }
    public String getParentId() { return parentId; }
    public List<String> getChildIds() { return Collections.unmodifiableList(childIds); }
    public CausalEventType getType() { return type; }
    public String getDescription() { return description; }
    public EventTiming getTiming() { return timing; }
    public Map<String, Object> getContext() { return Collections.unmodifiableMap(context); }
    public EventMetadata getMetadata() { return metadata; }

    public boolean isRoot() {
        return parentId == null;
    }

    @Override
    public String toString() {
        return "CausalEvent{" +
                "id='" + id + '\'' +
                ", chainId='" + chainId + '\'' +
                ", parentId='" + parentId + '\'' +
                ", type=" + type +
                ", description='" + description + '\'' +
                ", depth=" + metadata.getDepth() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CausalEvent that = (CausalEvent) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
