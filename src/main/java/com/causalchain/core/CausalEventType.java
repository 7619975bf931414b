package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of occurrence recorded in a causality chain.
 *
 * On the wire (JSON bodies, query parameters) each constant is written in
 * lower snake case, e.g. {@code user_action}.
 */
public enum CausalEventType {

    /** User clicks, key presses, gestures. */
    USER_ACTION,
    /** HTTP or RPC calls. */
    API_CALL,
    /** Updates to application state. */
    STATE_CHANGE,
    /** Component renders. */
    RENDER,
    /** Timers, futures and other deferred work. */
    ASYNC_OPERATION,
    /** System-level events. */
    SYSTEM_EVENT,
    ERROR,
    PERFORMANCE,
    /** Route or page changes. */
    NAVIGATION,
    WEBSOCKET,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CausalEventType fromWireName(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("event type cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event type: " + value);
        }
    }
}
