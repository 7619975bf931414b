package com.causalchain.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Limits applied by a {@link CausalityTracker}.
 */
@Getter
@ToString
public class CausalityOptions {

    /** Events in one chain before it is ended automatically. */
    private final int maxChainLength;

    /** Age after which a chain is expired by the cleanup sweep. */
    private final Duration maxChainDuration;

    /** Live chains kept after a cleanup sweep. */
    private final int maxChainsInMemory;

    /** Period of the background sweep; zero disables the scheduler. */
    private final Duration cleanupInterval;

    @Builder
    private CausalityOptions(Integer maxChainLength, Duration maxChainDuration,
                             Integer maxChainsInMemory, Duration cleanupInterval) {
        this.maxChainLength = maxChainLength != null ? maxChainLength : 100;
        this.maxChainDuration = maxChainDuration != null ? maxChainDuration : Duration.ofSeconds(30);
        this.maxChainsInMemory = maxChainsInMemory != null ? maxChainsInMemory : 50;
        this.cleanupInterval = cleanupInterval != null ? cleanupInterval : Duration.ofMinutes(1);

        if (this.maxChainLength <= 0) {
            throw new IllegalArgumentException("maxChainLength must be positive, got " + this.maxChainLength);
        }
        if (this.maxChainsInMemory <= 0) {
            throw new IllegalArgumentException("maxChainsInMemory must be positive, got " + this.maxChainsInMemory);
        }
        if (this.maxChainDuration.isNegative() || this.maxChainDuration.isZero()) {
            throw new IllegalArgumentException("maxChainDuration must be positive, got " + this.maxChainDuration);
        }
        if (this.cleanupInterval.isNegative()) {
            throw new IllegalArgumentException("cleanupInterval cannot be negative, got " + this.cleanupInterval);
        }
    }

    public static CausalityOptions defaults() {
        return CausalityOptions.builder().build();
    }
}
