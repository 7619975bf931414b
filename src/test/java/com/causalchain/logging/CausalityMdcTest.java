package com.causalchain.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CausalityMdcTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void bindsValuesAsStringsAndRemovesThemOnClose() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("causalityChainId", "chain_1");
        context.put("causalityDepth", 2);

        try (CausalityMdc.Scope ignored = CausalityMdc.bind(context)) {
            assertThat(MDC.get("causalityChainId")).isEqualTo("chain_1");
            assertThat(MDC.get("causalityDepth")).isEqualTo("2");
        }

        assertThat(MDC.get("causalityChainId")).isNull();
        assertThat(MDC.get("causalityDepth")).isNull();
    }

    @Test
    void restoresOuterValuesWhenNested() {
        MDC.put("causalityEventId", "event_outer");

        try (CausalityMdc.Scope ignored = CausalityMdc.bind(Map.of("causalityEventId", "event_inner"))) {
            assertThat(MDC.get("causalityEventId")).isEqualTo("event_inner");
        }

        assertThat(MDC.get("causalityEventId")).isEqualTo("event_outer");
    }

    @Test
    void emptyContextLeavesMdcUntouched() {
        MDC.put("requestId", "r-1");

        try (CausalityMdc.Scope scope = CausalityMdc.bind(Collections.emptyMap())) {
            assertThat(scope).isSameAs(CausalityMdc.Scope.NOOP);
        }
        assertThat(CausalityMdc.bind(null)).isSameAs(CausalityMdc.Scope.NOOP);
        assertThat(MDC.get("requestId")).isEqualTo("r-1");
    }
}
