package com.frontdesk.test.domain;

import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.NeedsFlags;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.service.SafeRegexCompiler;
import com.frontdesk.domain.scenario.service.ScenarioCompileDomainService;
import com.frontdesk.test.support.ScenarioFixtures;
import com.frontdesk.types.enums.ActionTypeEnum;
import com.frontdesk.types.enums.FollowUpModeEnum;
import com.frontdesk.types.enums.ReplyStrategyEnum;
import com.frontdesk.types.enums.ScenarioTypeEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ScenarioCompileDomainServiceTest {

    private final ScenarioCompileDomainService service = ScenarioFixtures.compiler();

    @Test
    public void shouldCompileNoHeatScenario() {
        RuntimeSpec spec = service.compile(ScenarioFixtures.noHeat());

        Assertions.assertFalse(spec.needs().nameVariant());
        Assertions.assertEquals(List.of("no heat", "furnace broken"), spec.triggers().normalized());
        Assertions.assertEquals(2, spec.meta().triggerCount());
        Assertions.assertEquals(ScenarioTypeEnum.EMERGENCY, spec.scenarioType());
        Assertions.assertTrue(spec.active());
    }

    @Test
    public void shouldBeIdempotentWithFixedClock() {
        RawScenario raw = ScenarioFixtures.noHeat();
        raw.setRegexTriggers(new ArrayList<>(List.of("\\bno\\s+heat\\b")));
        raw.setTtsOverride(Map.of("rate", 0.9));

        RuntimeSpec first = service.compile(raw, CompileOptions.of("hvac_v1", "HVAC"));
        RuntimeSpec second = service.compile(raw, CompileOptions.of("hvac_v1", "HVAC"));

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(1, first.triggers().regex().size());
    }

    @Test
    public void shouldFallBackToDefaultsForNullScenario() {
        RuntimeSpec spec = service.compile(null);

        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_NAME, spec.name());
        Assertions.assertTrue(spec.id().startsWith("scenario_"));
        Assertions.assertEquals(spec.id(), service.compile(new RawScenario()).id());
        Assertions.assertEquals(ScenarioTypeEnum.FAQ, spec.scenarioType());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_PRIORITY, spec.priority());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_MIN_CONFIDENCE, spec.minConfidence());
        Assertions.assertEquals(FollowUpModeEnum.NONE, spec.followUp().mode());
        Assertions.assertEquals(ActionTypeEnum.REPLY_ONLY, spec.wiring().actionType());
        Assertions.assertEquals(NeedsFlags.NONE, spec.needs());
        Assertions.assertTrue(spec.triggers().normalized().isEmpty());
        Assertions.assertTrue(spec.active());
    }

    @Test
    public void shouldNormalizeTriggersAndSkipNonStrings() {
        RawScenario raw = RawScenario.builder()
                .scenarioId("mixed")
                .triggers(new ArrayList<>(Arrays.asList("  No HEAT ", 7, null, "a", "AC Broken")))
                .build();

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals(List.of("no heat", "ac broken"), spec.triggers().normalized());
    }

    @Test
    public void shouldMapUnknownEnumsToFallbackVariants() {
        RawScenario raw = RawScenario.builder()
                .scenarioId("odd")
                .scenarioType("weather_chat")
                .followUpMode("maybe_later")
                .actionType("launch_rocket")
                .replyStrategy("llm_wrap")
                .build();

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals(ScenarioTypeEnum.FAQ, spec.scenarioType());
        Assertions.assertEquals(FollowUpModeEnum.UNKNOWN, spec.followUp().mode());
        Assertions.assertEquals(ActionTypeEnum.UNKNOWN, spec.wiring().actionType());
        Assertions.assertEquals(ReplyStrategyEnum.LLM_WRAP, spec.replies().strategy());
        Assertions.assertTrue(spec.needs().llmRewrite());
    }

    @Test
    public void shouldComputeNeedsFlagsIndependently() {
        RawScenario raw = RawScenario.builder()
                .scenarioId("needs")
                .quickReplies(new ArrayList<>(List.of("Thanks {NAME}!")))
                .timedFollowUp(Map.of("enabled", true))
                .silencePolicy(Map.of("enabled", false))
                .preconditions(new ArrayList<>(List.of("hasAddress")))
                .effects(new ArrayList<>(List.of(Map.of("set", "x"))))
                .build();

        NeedsFlags needs = service.compile(raw).needs();

        Assertions.assertTrue(needs.nameVariant());
        Assertions.assertTrue(needs.timedFollowUp());
        Assertions.assertFalse(needs.silencePolicy());
        Assertions.assertTrue(needs.preconditions());
        Assertions.assertTrue(needs.effects());
        Assertions.assertFalse(needs.ttsOverride());
        Assertions.assertFalse(needs.actionHooks());
        Assertions.assertEquals(List.of("nameVariant", "timedFollowUp", "preconditions", "effects"),
                needs.enabledSettings());
    }

    @Test
    public void shouldTreatStatusAndIsActiveTogether() {
        RawScenario draft = ScenarioFixtures.scenario("draft", "draft trigger");
        draft.setStatus("draft");
        RawScenario disabled = ScenarioFixtures.scenario("disabled", "disabled trigger");
        disabled.setIsActive(false);
        RawScenario live = ScenarioFixtures.scenario("live", "live trigger");
        live.setStatus(" LIVE ");

        Assertions.assertFalse(service.compile(draft).active());
        Assertions.assertFalse(service.compile(disabled).active());
        Assertions.assertTrue(service.compile(live).active());
    }

    @Test
    public void shouldDropUnsafeRegexWithoutFailingScenario() {
        RawScenario raw = ScenarioFixtures.scenario("regex", "heat pump");
        raw.setRegexTriggers(new ArrayList<>(Arrays.asList("(a+)+$", "[unclosed", "heat\\s+pump", 5)));

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals(1, spec.triggers().regex().size());
        Assertions.assertEquals("heat\\s+pump", spec.triggers().regex().get(0).getSource());
    }

    @Test
    public void shouldReadReplyObjectsAndClampValues() {
        RawScenario raw = RawScenario.builder()
                .scenarioId("replies")
                .quickReplies(new ArrayList<>(Arrays.asList(Map.of("text", "From object"), 12, "  ")))
                .fullRepliesNoName(new ArrayList<>(List.of("Full without name")))
                .minConfidence(3.5)
                .cooldownSeconds(-10)
                .build();

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals(List.of("From object"), spec.replies().quick());
        Assertions.assertTrue(spec.meta().hasNoNameVariants());
        Assertions.assertEquals(1.0D, spec.minConfidence());
        Assertions.assertEquals(0, spec.cooldownSeconds());
    }

    @Test
    public void shouldDeriveStableIdForScenarioWithoutIdWhileClockAdvances() {
        Clock ticking = Mockito.mock(Clock.class);
        Mockito.when(ticking.millis()).thenReturn(1000L, 1001L, 1002L, 1003L);
        ScenarioCompileDomainService tickingService = new ScenarioCompileDomainService(new SafeRegexCompiler(), ticking);
        RawScenario raw = ScenarioFixtures.noHeat();
        raw.setScenarioId(null);

        RuntimeSpec first = tickingService.compile(raw, CompileOptions.of("hvac_v1", "HVAC"));
        RuntimeSpec second = tickingService.compile(raw, CompileOptions.of("hvac_v1", "HVAC"));

        Assertions.assertEquals(first.id(), second.id());
        Assertions.assertTrue(first.id().startsWith("scenario_"));
        Assertions.assertNotEquals(first.meta().compiledAt(), second.meta().compiledAt());

        RawScenario other = ScenarioFixtures.noHeat();
        other.setScenarioId(" ");
        other.setTriggers(new ArrayList<>(List.of("no cooling")));
        Assertions.assertNotEquals(first.id(), tickingService.compile(other, CompileOptions.of("hvac_v1", "HVAC")).id());
    }

    @Test
    public void shouldDefaultEachMistypedFieldWithoutDroppingScenario() {
        RawScenario raw = RawScenario.builder()
                .scenarioId("mistyped")
                .name(Map.of("en", "Mistyped"))
                .status(List.of("live"))
                .isActive("yes")
                .priority("very high")
                .minConfidence("strict")
                .cooldownSeconds(List.of(30))
                .triggers("no heat")
                .quickReplies(Map.of("text", "single object"))
                .requiredSlots("address")
                .bookingIntent("true")
                .timedFollowUp(true)
                .ttsOverride("fast")
                .preconditions(Map.of("hasAddress", true))
                .build();

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals("mistyped", spec.id());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_NAME, spec.name());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_STATUS, spec.status());
        Assertions.assertTrue(spec.active());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_PRIORITY, spec.priority());
        Assertions.assertEquals(ScenarioCompileDomainService.DEFAULT_MIN_CONFIDENCE, spec.minConfidence());
        Assertions.assertEquals(0, spec.cooldownSeconds());
        Assertions.assertTrue(spec.triggers().normalized().isEmpty());
        Assertions.assertTrue(spec.replies().quick().isEmpty());
        Assertions.assertTrue(spec.wiring().requiredSlots().isEmpty());
        Assertions.assertFalse(spec.wiring().bookingIntent());
        Assertions.assertEquals(NeedsFlags.NONE, spec.needs());
        Assertions.assertTrue(spec.raw().preconditions().isEmpty());
    }

    @Test
    public void shouldAcceptNumericPriorityOfAnyWidth() {
        RawScenario raw = ScenarioFixtures.scenario("wide", "heat pump");
        raw.setPriority(75L);
        raw.setMinConfidence(1);

        RuntimeSpec spec = service.compile(raw);

        Assertions.assertEquals(75, spec.priority());
        Assertions.assertEquals(1.0D, spec.minConfidence());
    }
}
