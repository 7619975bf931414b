package com.causalchain;

import com.causalchain.core.CausalEvent;
import com.causalchain.core.CausalEventType;
import com.causalchain.core.CausalityChain;
import com.causalchain.core.CausalityOptions;
import com.causalchain.core.CausalityTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CausalityTest {

    private CausalityTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new CausalityTracker(CausalityOptions.builder().cleanupInterval(Duration.ZERO).build());
        Causality.install(tracker);
    }

    @AfterEach
    void tearDown() {
        tracker.destroy();
    }

    @Test
    void facadeRecordsOnInstalledTracker() {
        String chainId = Causality.startCausalChain(CausalEventType.USER_ACTION, "click-save");
        String eventId = Causality.addCausalEvent(CausalEventType.API_CALL, "POST /save");
        Causality.completeCausalEvent(eventId, new IllegalStateException("timeout"));

        assertThat(Causality.tracker()).isSameAs(tracker);
        assertThat(Causality.getCausalityLogContext())
                .containsEntry(CausalityTracker.CONTEXT_CHAIN_ID, chainId)
                .containsEntry(CausalityTracker.CONTEXT_EVENT_ID, eventId);

        Causality.endCurrentChain();

        CausalityChain chain = tracker.getChain(chainId).orElseThrow();
        assertThat(chain.getMetadata().isEnded()).isTrue();
        assertThat(chain.hasError()).isTrue();
        assertThat(Causality.getCausalityLogContext()).isEmpty();
    }

    @Test
    void facadeSwallowsTrackerFailures() {
        assertThat(Causality.startCausalChain(null, "no type")).isNull();
        assertThat(Causality.addCausalEvent(null, "no type")).isNull();

        Causality.completeCausalEvent("event_missing");
        Causality.endCurrentChain();

        assertThat(tracker.getChainCount()).isZero();
    }

    @Test
    void wrappedFunctionsUseTrackerInstalledLater() throws Exception {
        Callable<String> task = Causality.withCausality(() -> "ok", CausalEventType.ASYNC_OPERATION, "job", null);
        Function<Integer, CompletableFuture<Integer>> twice = Causality.withCausality(
                n -> CompletableFuture.completedFuture(n * 2), CausalEventType.API_CALL, "double");

        CausalityTracker replacement = new CausalityTracker(CausalityOptions.builder()
                .cleanupInterval(Duration.ZERO).build());
        try {
            Causality.install(replacement);

            assertThat(task.call()).isEqualTo("ok");
            assertThat(twice.apply(21).get(1, TimeUnit.SECONDS)).isEqualTo(42);

            assertThat(tracker.getEventCount()).isZero();
            CausalityChain chain = replacement.getChains().get(0);
            assertThat(chain.getEvents()).extracting(CausalEvent::getDescription).containsExactly("job", "double");
        } finally {
            Causality.install(tracker);
            replacement.destroy();
        }
    }

    @Test
    void installKeepsCallerOwnedTrackerAlive() {
        tracker.startChain(CausalEventType.USER_ACTION, "click");
        CausalityTracker other = new CausalityTracker(CausalityOptions.builder()
                .cleanupInterval(Duration.ZERO).build());
        try {
            Causality.install(other);

            assertThat(tracker.getChainCount()).isEqualTo(1);
        } finally {
            Causality.install(tracker);
            other.destroy();
        }
    }

    @Test
    void installRejectsNull() {
        assertThatThrownBy(() -> Causality.install(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
