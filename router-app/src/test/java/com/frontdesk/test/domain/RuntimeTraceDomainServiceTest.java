package com.frontdesk.test.domain;

import com.frontdesk.domain.scenario.model.valobj.MatchInfo;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.RuntimeTrace;
import com.frontdesk.domain.scenario.model.valobj.TurnTimings;
import com.frontdesk.domain.scenario.service.RuntimeTraceDomainService;
import com.frontdesk.test.support.ScenarioFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RuntimeTraceDomainServiceTest {

    private final RuntimeTraceDomainService service = new RuntimeTraceDomainService(ScenarioFixtures.FIXED_CLOCK);

    @Test
    public void shouldListTierZeroThenEnabledSettingsInTierOrder() {
        RawScenario raw = ScenarioFixtures.noHeat();
        raw.setReplyStrategy("LLM_CONTEXT");
        raw.setActionHooks(new ArrayList<>(List.of("notifyDispatch")));
        raw.setQuickReplies(new ArrayList<>(List.of("Hi {name}, we're on it.")));
        RuntimeSpec spec = ScenarioFixtures.compiler().compile(raw);

        RuntimeTrace trace = service.buildTrace(spec, MatchInfo.builder()
                .companyId("acme-hvac")
                .method("exact")
                .confidence(0.92D)
                .tier(1)
                .replyType("full")
                .replyIndex(2)
                .build(), new TurnTimings(3L, 4L, 5L, 12L));

        Assertions.assertEquals(List.of("replySelection", "placeholderRendering", "structureEnforcement",
                "nameVariant", "actionHooks", "llmRewrite"), trace.appliedSettings());
        Assertions.assertEquals("no_heat", trace.scenarioIdMatched());
        Assertions.assertEquals("acme-hvac", trace.companyId());
        Assertions.assertEquals(0.92D, trace.matchConfidence());
        Assertions.assertEquals("full", trace.replyType());
        Assertions.assertEquals(12L, trace.latencyBreakdownMs().total());
        Assertions.assertEquals(ScenarioFixtures.FIXED_CLOCK.millis(), trace.timestamp());
        Assertions.assertEquals(11, trace.needsEvaluated().size());
        Assertions.assertEquals("nameVariant", trace.needsEvaluated().keySet().iterator().next());
    }

    @Test
    public void shouldUseFallbackSentinelWithoutSpec() {
        RuntimeTrace trace = service.buildTrace(null, null, null);

        Assertions.assertEquals("fallback", trace.scenarioIdMatched());
        Assertions.assertNull(trace.scenarioNameMatched());
        Assertions.assertEquals(List.of("fallback"), trace.appliedSettings());
        Assertions.assertEquals("unknown", trace.matchMethod());
        Assertions.assertEquals("quick", trace.replyType());
        Assertions.assertEquals(0, trace.matchTier());
        Assertions.assertEquals(TurnTimings.ZERO, trace.latencyBreakdownMs());
        Assertions.assertEquals(Map.of(), trace.needsEvaluated());
    }

    @Test
    public void shouldLogTraceWithoutFailing() {
        RuntimeTrace trace = service.buildTrace(ScenarioFixtures.compiler().compile(ScenarioFixtures.noHeat()),
                MatchInfo.builder().method("contains").build(), TurnTimings.ZERO);

        Assertions.assertDoesNotThrow(() -> service.logTrace(trace));
        Assertions.assertDoesNotThrow(() -> service.logTrace(null));
    }
}
