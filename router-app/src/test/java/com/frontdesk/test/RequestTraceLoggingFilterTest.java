package com.frontdesk.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontdesk.api.response.Response;
import com.frontdesk.config.ObservabilityHttpLogProperties;
import com.frontdesk.config.RequestTraceLoggingFilter;
import com.frontdesk.types.enums.ResponseCode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RequestTraceLoggingFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ObservabilityHttpLogProperties properties = new ObservabilityHttpLogProperties();
        properties.setExcludePathPatterns(List.of("/api/health/**"));
        this.mockMvc = MockMvcBuilders.standaloneSetup(new PingController())
                .addFilters(new RequestTraceLoggingFilter(new ObjectMapper(), properties))
                .build();
    }

    @Test
    public void shouldEchoIncomingTraceHeaders() throws Exception {
        mockMvc.perform(get("/api/ping")
                        .header("X-Trace-Id", "trace-001")
                        .header("X-Request-Id", "req-001"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Trace-Id", "trace-001"))
                .andExpect(header().string("X-Request-Id", "req-001"))
                .andExpect(jsonPath("$.data").value("trace-001"));

        Assertions.assertNull(MDC.get("traceId"));
    }

    @Test
    public void shouldGenerateTraceIdWhenMissingAndKeepBody() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/failing").param("token", "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.POOL_NOT_FOUND.getCode()))
                .andReturn();

        String traceId = result.getResponse().getHeader("X-Trace-Id");
        Assertions.assertNotNull(traceId);
        Assertions.assertEquals(32, traceId.length());
    }

    @Test
    public void shouldSkipExcludedAndNonApiPaths() throws Exception {
        mockMvc.perform(get("/api/health/live"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"));

        mockMvc.perform(get("/internal/ping"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist("X-Trace-Id"));
    }

    @RestController
    private static class PingController {

        @GetMapping("/api/ping")
        public Response<String> ping() {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(MDC.get("traceId"))
                    .build();
        }

        @GetMapping("/api/failing")
        public Response<Void> failing() {
            return Response.<Void>builder()
                    .code(ResponseCode.POOL_NOT_FOUND.getCode())
                    .info(ResponseCode.POOL_NOT_FOUND.getInfo())
                    .build();
        }

        @GetMapping({"/api/health/live", "/internal/ping"})
        public Response<Void> health() {
            return Response.<Void>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .build();
        }
    }
}
