package com.causalchain.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies a causality context into the SLF4J MDC so that log lines written
 * inside a {@link Scope} carry the chain id, event id and depth.
 *
 * <pre>
 * try (CausalityMdc.Scope scope = CausalityMdc.bind(tracker.getCausalityContext())) {
 *     log.info("saving document");
 * }
 * </pre>
 */
public final class CausalityMdc {

    private CausalityMdc() {
    }

    public static Scope bind(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return Scope.NOOP;
        }
        Map<String, String> previous = new HashMap<>();
        List<String> keys = new ArrayList<>(context.size());
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            String key = entry.getKey();
            keys.add(key);
            previous.put(key, MDC.get(key));
            MDC.put(key, String.valueOf(entry.getValue()));
        }
        return () -> {
            for (String key : keys) {
                String value = previous.get(key);
                if (value != null) {
                    MDC.put(key, value);
                } else {
                    MDC.remove(key);
                }
            }
        };
    }

    /**
     * Restores the MDC entries that were replaced when the scope was bound.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        Scope NOOP = () -> { };

        @Override
        void close();
    }
}
