package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainMetadata {

    private final long startTime;
    private Long endTime;
    private Long totalDuration;
    private int eventCount;
    private int maxDepth;
    private final List<String> tags;

    ChainMetadata(long startTime, List<String> tags) {
        this.startTime = startTime;
        this.eventCount = 1;
        this.maxDepth = 0;
        this.tags = new ArrayList<>(tags != null ? tags : Collections.emptyList());
    }

    ChainMetadata(ChainMetadata other) {
        this.startTime = other.startTime;
        this.endTime = other.endTime;
        this.totalDuration = other.totalDuration;
        this.eventCount = other.eventCount;
        this.maxDepth = other.maxDepth;
        this.tags = new ArrayList<>(other.tags);
    }

    void recordAppend(int eventCount, int depth) {
        this.eventCount = eventCount;
        this.maxDepth = Math.max(this.maxDepth, depth);
    }

    void end(long now) {
        this.endTime = Math.max(now, startTime);
        this.totalDuration = endTime - startTime;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public boolean isEnded() {
        return endTime != null;
    }
}
