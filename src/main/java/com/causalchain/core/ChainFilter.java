package com.causalchain.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Criteria for {@link CausalityTracker#getChains(ChainFilter)}. Unset
 * criteria match every chain.
 */
@Getter
@Builder
@ToString
public class ChainFilter {

    /** Type of the chain's root cause. */
    private final CausalEventType type;

    /** Inclusive lower bound on chain start time (epoch ms). */
    private final Long startFrom;

    /** Inclusive upper bound on chain start time (epoch ms). */
    private final Long startTo;

    /** Chain matches when it carries at least one of these tags. */
    private final List<String> tags;

    /** When set, keep only chains that do (or do not) contain a failed event. */
    private final Boolean hasError;

    public boolean matches(CausalityChain chain) {
        if (type != null && chain.getRootCause().getType() != type) {
            return false;
        }

        long startTime = chain.getMetadata().getStartTime();
        if (startFrom != null && startTime < startFrom) {
            return false;
        }
        if (startTo != null && startTime > startTo) {
            return false;
        }

        if (tags != null && !tags.isEmpty()) {
            Set<String> chainTags = new HashSet<>(chain.getMetadata().getTags());
            if (tags.stream().noneMatch(chainTags::contains)) {
                return false;
            }
        }

        return hasError == null || chain.hasError() == hasError;
    }
}
