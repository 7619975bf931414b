package com.causalchain.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CausalEventTypeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void wireNamesAreLowerSnakeCase() throws Exception {
        assertThat(CausalEventType.USER_ACTION.wireName()).isEqualTo("user_action");
        assertThat(CausalEventType.fromWireName("async_operation")).isEqualTo(CausalEventType.ASYNC_OPERATION);
        assertThat(mapper.writeValueAsString(CausalEventType.WEBSOCKET)).isEqualTo("\"websocket\"");
        assertThat(mapper.readValue("\"state_change\"", CausalEventType.class)).isEqualTo(CausalEventType.STATE_CHANGE);
        assertThat(Severity.fromWireName("low")).isEqualTo(Severity.LOW);
    }

    @Test
    void unknownOrEmptyNamesAreRejected() {
        assertThatThrownBy(() -> CausalEventType.fromWireName("bogus"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bogus");
        assertThatThrownBy(() -> CausalEventType.fromWireName(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CausalEventType.fromWireName(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
