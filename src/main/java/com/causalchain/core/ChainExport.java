package com.causalchain.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Read-only snapshot of one chain for external debugging tools.
 */
@Getter
@AllArgsConstructor
public class ChainExport {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final CausalityChain chain;
    private final List<TimelineEntry> timeline;
    private final PerformanceImpact performance;

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export of chain " + chain.getId(), e);
        }
    }
}
