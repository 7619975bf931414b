package com.causalchain.core;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Caller-supplied metadata for a new event. Depth is never part of it: the
 * tracker derives depth from the parent event.
 */
@Getter
@Builder
public class EventDetails {

    private static final EventDetails NONE = EventDetails.builder().build();

    private final Severity severity;
    @Singular
    private final List<String> tags;
    private final Object data;

    public static EventDetails none() {
        return NONE;
    }

    public static EventDetails ofSeverity(Severity severity) {
        return EventDetails.builder().severity(severity).build();
    }
}
