package com.causalchain.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TimelineEntry {

    private final CausalEvent event;
    private final int depth;
    /** Null while the event is still running. */
    private final Long duration;
    private final List<String> children;
}
