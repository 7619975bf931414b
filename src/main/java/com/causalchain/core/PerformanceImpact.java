package com.causalchain.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class PerformanceImpact {

    private static final PerformanceImpact EMPTY = new PerformanceImpact(0L, null, 0, 0.0);

    /** Recorded chain duration; 0 while the chain is still open. */
    private final long totalDuration;

    /** First completed event with the longest duration, or null if none completed. */
    private final CausalEvent slowestEvent;

    private final int errorCount;

    /** Mean duration of completed events; 0 when none completed. */
    private final double averageEventDuration;

    public static PerformanceImpact empty() {
        return EMPTY;
    }
}
