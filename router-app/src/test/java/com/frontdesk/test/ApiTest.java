package com.frontdesk.test;

import com.frontdesk.domain.scenario.service.ScenarioPoolRegistry;
import com.frontdesk.trigger.application.command.ScenarioPoolCommandService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 启动完整上下文，验证装配关系与内置示例场景源。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class ApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ScenarioPoolCommandService scenarioPoolCommandService;

    @Autowired
    private ScenarioPoolRegistry scenarioPoolRegistry;

    @Test
    public void shouldServeBundledDemoCompany() throws Exception {
        scenarioPoolCommandService.rebuild("demo-hvac");
        Assertions.assertTrue(scenarioPoolRegistry.current("demo-hvac").isPresent());

        mockMvc.perform(get("/api/v1/scenario-pools/{companyId}/lookup", "demo-hvac").param("q", "no heat"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.exactMatchId").value("no_heat"));

        mockMvc.perform(get("/api/v1/truth-bundle")
                        .param("companyId", "demo-hvac")
                        .param("environment", "production"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.meta.integrity").value("COMPLETE"));
        log.info("测试完成");
    }
}
