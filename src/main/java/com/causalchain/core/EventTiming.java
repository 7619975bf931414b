package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

/**
 * Start and completion times of an event, in epoch milliseconds.
 * {@code endTime} and {@code duration} stay null until the event completes.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventTiming {

    private final long startTime;
    private Long endTime;
    private Long duration;

    EventTiming(long startTime) {
        this.startTime = startTime;
    }

    EventTiming(EventTiming other) {
        this.startTime = other.startTime;
        this.endTime = other.endTime;
        this.duration = other.duration;
    }

    void complete(long now) {
        // a wall clock step backwards must not end an event before it started
        this.endTime = Math.max(now, startTime);
        this.duration = endTime - startTime;
    }

    public boolean isCompleted() {
        return duration != null;
    }
}
