package com.causalchain.controller;

import com.causalchain.core.CausalEventType;
import com.causalchain.core.CausalityTracker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "causality.cleanup-interval=0")
@AutoConfigureMockMvc
class CausalityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CausalityTracker tracker;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        tracker.clear();
    }

    private JsonNode postJson(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String startChain() throws Exception {
        JsonNode chain = postJson("/api/v1/chains",
                "{\"type\":\"user_action\",\"description\":\"click-save\",\"tags\":[\"editor\"],"
                        + "\"context\":{\"component\":\"SaveButton\"}}");
        return chain.get("id").asText();
    }

    @Test
    void startChainReturnsCreatedChain() throws Exception {
        mockMvc.perform(post("/api/v1/chains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"user_action\",\"description\":\"click-save\",\"severity\":\"high\"}"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", containsString("/api/v1/chains/chain_")))
                .andExpect(jsonPath("$.rootCause.type").value("user_action"))
                .andExpect(jsonPath("$.rootCause.metadata.severity").value("high"))
                .andExpect(jsonPath("$.rootCause.metadata.depth").value(0))
                .andExpect(jsonPath("$.metadata.eventCount").value(1));

        assertThat(tracker.getChainCount()).isEqualTo(1);
    }

    @Test
    void startChainRejectsInvalidInput() throws Exception {
        mockMvc.perform(post("/api/v1/chains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"bogus\",\"description\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("Unknown event type: bogus")));

        mockMvc.perform(post("/api/v1/chains")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"user_action\",\"description\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("description")));
    }

    @Test
    void addEventAttachesToLatestOrExplicitParent() throws Exception {
        String chainId = startChain();
        String rootId = tracker.getChain(chainId).orElseThrow().getRootCause().getId();

        JsonNode api = postJson("/api/v1/chains/" + chainId + "/events",
                "{\"type\":\"api_call\",\"description\":\"POST /save\"}");
        assertThat(api.get("parentId").asText()).isEqualTo(rootId);
        assertThat(api.path("metadata").path("depth").asInt()).isEqualTo(1);

        JsonNode render = postJson("/api/v1/chains/" + chainId + "/events",
                "{\"type\":\"render\",\"description\":\"spinner\",\"parentEventId\":\"" + rootId + "\"}");
        assertThat(render.get("parentId").asText()).isEqualTo(rootId);

        mockMvc.perform(get("/api/v1/events/" + rootId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.childIds", hasSize(2)));
    }

    @Test
    void addEventToUnknownChainIsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/chains/chain_missing/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"api_call\",\"description\":\"x\"}"))
                .andExpect(status().isNotFound())
                .andExpect(content().string(containsString("chain_missing")));
    }

    @Test
    void completeEventWithErrorMarksChainFailed() throws Exception {
        String chainId = startChain();
        String apiId = postJson("/api/v1/chains/" + chainId + "/events",
                "{\"type\":\"api_call\",\"description\":\"POST /save\"}").get("id").asText();

        mockMvc.perform(post("/api/v1/events/" + apiId + "/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"errorType\":\"TimeoutError\",\"errorMessage\":\"timeout\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.error.type").value("TimeoutError"))
                .andExpect(jsonPath("$.metadata.error.message").value("timeout"))
                .andExpect(jsonPath("$.metadata.severity").value("high"))
                .andExpect(jsonPath("$.timing.duration").exists());

        mockMvc.perform(get("/api/v1/chains").param("hasError", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(chainId));

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/performance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errorCount").value(1))
                .andExpect(jsonPath("$.slowestEvent.id").exists());

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/graph/json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.edges[0].to").value(apiId))
                .andExpect(jsonPath("$.edges[0].failed").value(true))
                .andExpect(jsonPath("$.edges[0].dashes").value(true));
    }

    @Test
    void completeUnknownEventIsNotFound() throws Exception {
        mockMvc.perform(post("/api/v1/events/event_missing/complete"))
                .andExpect(status().isNotFound());
    }

    @Test
    void endChainRecordsTotalDuration() throws Exception {
        String chainId = startChain();

        mockMvc.perform(post("/api/v1/chains/" + chainId + "/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.endTime").exists())
                .andExpect(jsonPath("$.metadata.totalDuration").exists());

        mockMvc.perform(post("/api/v1/chains/chain_missing/end"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listChainsAppliesFilters() throws Exception {
        String chainId = startChain();
        tracker.startChain(CausalEventType.NAVIGATION, "/settings");

        mockMvc.perform(get("/api/v1/chains"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/v1/chains").param("type", "user_action"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").value(chainId));

        mockMvc.perform(get("/api/v1/chains").param("tags", "editor", "other"))
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get("/api/v1/chains").param("type", "nope"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void timelineExportAndGraphViews() throws Exception {
        String chainId = startChain();
        postJson("/api/v1/chains/" + chainId + "/events", "{\"type\":\"api_call\",\"description\":\"POST \\\"save\\\"\"}");

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/timeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].depth").value(0))
                .andExpect(jsonPath("$[0].children", hasSize(1)))
                .andExpect(jsonPath("$[1].depth").value(1));

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chain.id").value(chainId))
                .andExpect(jsonPath("$.timeline", hasSize(2)))
                .andExpect(jsonPath("$.performance.errorCount").value(0));

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/graph/json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes", hasSize(2)))
                .andExpect(jsonPath("$.edges", hasSize(1)))
                .andExpect(jsonPath("$.edges[0].arrows").value("to"))
                .andExpect(jsonPath("$.edges[0].depth").value(1))
                .andExpect(jsonPath("$.edges[0].failed").value(false));

        mockMvc.perform(get("/api/v1/chains/" + chainId + "/graph/dot"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", containsString("text/vnd.graphviz")))
                .andExpect(content().string(containsString("digraph CausalityChain")))
                .andExpect(content().string(containsString("POST \\\"save\\\"")))
                .andExpect(content().string(containsString(" -> ")));
    }

    @Test
    void unknownChainViewsAreNotFound() throws Exception {
        for (String view : new String[]{"", "/timeline", "/performance", "/export", "/graph/json", "/graph/dot"}) {
            mockMvc.perform(get("/api/v1/chains/chain_missing" + view))
                    .andExpect(status().isNotFound());
        }
    }

    @Test
    void ancestryAndDescendants() throws Exception {
        String chainId = startChain();
        String rootId = tracker.getChain(chainId).orElseThrow().getRootCause().getId();
        String apiId = postJson("/api/v1/chains/" + chainId + "/events",
                "{\"type\":\"api_call\",\"description\":\"call\"}").get("id").asText();

        mockMvc.perform(get("/api/v1/events/" + apiId + "/ancestry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value(rootId))
                .andExpect(jsonPath("$[1]").value(apiId));

        mockMvc.perform(get("/api/v1/events/" + rootId + "/descendants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(get("/api/v1/events/event_missing/ancestry"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/v1/events/event_missing/descendants"))
                .andExpect(status().isNotFound());
    }

    @Test
    void contextAndStats() throws Exception {
        String chainId = startChain();

        mockMvc.perform(get("/api/v1/context"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.causalityChainId").value(chainId))
                .andExpect(jsonPath("$.causalityRootCause").value("click-save"))
                .andExpect(jsonPath("$.causalityEventCount").value(1));

        mockMvc.perform(get("/api/v1/tracker/stats"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("chains=1")));
    }
}
