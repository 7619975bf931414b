package com.causalchain.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Timeline and performance views over a chain snapshot. Never mutates its
 * input.
 */
public final class ChainAnalyzer {

    private ChainAnalyzer() {
    }

    /**
     * Events ordered by start time. The sort is stable, so events that
     * started in the same millisecond keep their insertion order.
     */
    public static List<TimelineEntry> timeline(CausalityChain chain) {
        List<CausalEvent> sorted = new ArrayList<>(chain.getEvents());
        sorted.sort(Comparator.comparingLong(e -> e.getTiming().getStartTime()));

        List<TimelineEntry> timeline = new ArrayList<>(sorted.size());
        for (CausalEvent event : sorted) {
            timeline.add(new TimelineEntry(
                    event,
                    event.getMetadata().getDepth(),
                    event.getTiming().getDuration(),
                    event.getChildIds()));
        }
        return timeline;
    }

    public static PerformanceImpact performance(CausalityChain chain) {
        Long recordedTotal = chain.getMetadata().getTotalDuration();
        long totalDuration = recordedTotal != null ? recordedTotal : 0L;

        int errorCount = 0;
        int completed = 0;
        long durationSum = 0L;
        long maxDuration = -1L;
        CausalEvent slowestEvent = null;

        for (CausalEvent event : chain.getEvents()) {
            if (event.getMetadata().hasError()) {
                errorCount++;
            }
            Long duration = event.getTiming().getDuration();
            if (duration == null) {
                continue;
            }
            completed++;
            durationSum += duration;
            if (duration > maxDuration) {
                maxDuration = duration;
                slowestEvent = event;
            }
        }

        double average = completed > 0 ? (double) durationSum / completed : 0.0;
        return new PerformanceImpact(totalDuration, slowestEvent, errorCount, average);
    }

    public static ChainExport export(CausalityChain chain) {
        return new ChainExport(chain, timeline(chain), performance(chain));
    }
}
