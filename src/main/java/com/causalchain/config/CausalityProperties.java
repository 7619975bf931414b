package com.causalchain.config;

import com.causalchain.core.CausalityOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tracker limits bound from {@code causality.*}.
 */
@Data
@ConfigurationProperties(prefix = "causality")
public class CausalityProperties {

    private int maxChainLength = 100;
    private Duration maxChainDuration = Duration.ofSeconds(30);
    private int maxChainsInMemory = 50;
    private Duration cleanupInterval = Duration.ofMinutes(1);

    public CausalityOptions toOptions() {
        return CausalityOptions.builder()
                .maxChainLength(maxChainLength)
                .maxChainDuration(maxChainDuration)
                .maxChainsInMemory(maxChainsInMemory)
                .cleanupInterval(cleanupInterval)
                .build();
    }
}
