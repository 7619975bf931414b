package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventMetadata {

    private final int depth;
    private Severity severity;
    private final List<String> tags;
    private RecordedError error;
    private final Object data;

    EventMetadata(int depth, EventDetails details) {
        this.depth = depth;
        this.severity = details.getSeverity() != null ? details.getSeverity() : Severity.MEDIUM;
        this.tags = details.getTags() != null ? new ArrayList<>(details.getTags()) : new ArrayList<>();
        this.data = details.getData();
    }

    EventMetadata(EventMetadata other) {
        this.depth = other.depth;
        this.severity = other.severity;
        this.tags = new ArrayList<>(other.tags);
        this.error = other.error;
        this.data = other.data;
    }

    void recordError(RecordedError error) {
        this.error = error;
        this.severity = Severity.HIGH;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public boolean hasError() {
        return error != null;
    }
}
