package com.frontdesk.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontdesk.test.support.RouterStack;
import com.frontdesk.trigger.http.FlowController;
import com.frontdesk.trigger.http.GlobalApiExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Map;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class FlowControllerTest {

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        RouterStack stack = new RouterStack();
        this.objectMapper = stack.objectMapper;
        this.mockMvc = MockMvcBuilders.standaloneSetup(new FlowController(stack.flowTreeQueryService))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldExportFlowTreeWithBindings() throws Exception {
        mockMvc.perform(get("/api/v1/flow/tree"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.flowTree.nodes", hasSize(18)))
                .andExpect(jsonPath("$.data.flowTree.entryNodeId").isNotEmpty())
                .andExpect(jsonPath("$.data.runtimeBindings", hasSize(17)))
                .andExpect(jsonPath("$.data.validMatchSources", hasItem("SCENARIO_MATCH")))
                .andExpect(jsonPath("$.data.unreachableNodes").isEmpty())
                .andExpect(jsonPath("$.data.invalidEdgeIds").isEmpty())
                .andExpect(jsonPath("$.data.invalidPredicateEdgeIds").isEmpty());
    }

    @Test
    public void shouldResolveRuntimeDecisionToFlowNode() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of("checkpoint", "CHECKPOINT_8"));

        mockMvc.perform(post("/api/v1/flow/path-check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.inTree").value(true))
                .andExpect(jsonPath("$.data.flowNodeId").value("node.slotExtraction"))
                .andExpect(jsonPath("$.data.warning").doesNotExist());
    }

    @Test
    public void shouldWarnForOutOfTreeDecision() throws Exception {
        String payload = objectMapper.writeValueAsString(
                Map.of("matchSource", "LEGACY_ROUTER", "branchTaken", "LEGACY"));

        mockMvc.perform(post("/api/v1/flow/path-check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.inTree").value(false))
                .andExpect(jsonPath("$.data.warning.type").value("OUT_OF_TREE_PATH"))
                .andExpect(jsonPath("$.data.warning.matchSource").value("LEGACY_ROUTER"));
    }

    @Test
    public void shouldTreatMissingBodyAsOutOfTree() throws Exception {
        mockMvc.perform(post("/api/v1/flow/path-check").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.inTree").value(false));
    }
}
