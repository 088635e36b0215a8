package com.frontdesk.test.infrastructure;

import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.service.ScenarioPoolRegistry;
import com.frontdesk.infrastructure.gateway.wiring.ScenarioPoolWiringReportGenerator;
import com.frontdesk.test.support.ScenarioFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class ScenarioPoolWiringReportGeneratorTest {

    private ScenarioPoolRegistry registry;
    private ScenarioPoolWiringReportGenerator generator;

    @BeforeEach
    public void setUp() {
        registry = ScenarioFixtures.registry();
        generator = new ScenarioPoolWiringReportGenerator(registry);
    }

    @Test
    public void shouldReportRedWhenPoolNotPublished() {
        Map<String, Object> report = asMap(generator.generate("acme-hvac", null, "production"));

        Assertions.assertEquals(false, report.get("companyDocumentProvided"));
        Assertions.assertEquals(Map.of("published", false), report.get("scenarioPool"));
        Map<String, Object> health = asMap(report.get("health"));
        Assertions.assertEquals("RED", health.get("overall"));
        Assertions.assertEquals(List.of("SCENARIO_POOL_NOT_PUBLISHED"), codes(health.get("criticalIssues")));
    }

    @Test
    public void shouldReportGreenForHealthyPool() {
        registry.rebuild("acme-hvac", List.of(ScenarioFixtures.noHeat()), CompileOptions.of("hvac_residential_v1", null));

        Map<String, Object> report = asMap(generator.generate("acme-hvac", Map.of("name", "Acme"), "production"));

        Assertions.assertEquals(true, report.get("companyDocumentProvided"));
        Map<String, Object> pool = asMap(report.get("scenarioPool"));
        Assertions.assertEquals(true, pool.get("published"));
        Assertions.assertEquals(1L, pool.get("version"));
        Assertions.assertEquals("GREEN", asMap(report.get("health")).get("overall"));
    }

    @Test
    public void shouldReportYellowForShadowedTriggersAndMissingFlow() {
        RawScenario booking = ScenarioFixtures.scenario("book_visit", "book a visit");
        booking.setActionType("START_FLOW");
        RawScenario transfer = ScenarioFixtures.scenario("talk_to_human", "talk to a person");
        transfer.setFollowUpMode("TRANSFER");
        registry.rebuild("acme-hvac", List.of(
                ScenarioFixtures.scenario("no_heat", "no heat"),
                ScenarioFixtures.scenario("heat_out", "no heat", "heat is out"),
                booking,
                transfer), CompileOptions.none());

        Map<String, Object> health = asMap(asMap(generator.generate("acme-hvac", null, "development")).get("health"));

        Assertions.assertEquals("YELLOW", health.get("overall"));
        Assertions.assertEquals(List.of(), health.get("criticalIssues"));
        List<String> warnings = codes(health.get("warnings"));
        Assertions.assertTrue(warnings.contains("TRIGGER_SHADOWED"), warnings.toString());
        Assertions.assertTrue(warnings.contains("FLOW_ID_MISSING"), warnings.toString());
        Assertions.assertTrue(warnings.contains("TRANSFER_TARGET_MISSING"), warnings.toString());
    }

    @Test
    public void shouldReportRedForPoolWithoutActiveScenarios() {
        RawScenario draft = ScenarioFixtures.scenario("promo", "duct cleaning");
        draft.setStatus("draft");
        registry.rebuild("acme-hvac", List.of(draft), CompileOptions.none());

        Map<String, Object> health = asMap(asMap(generator.generate("acme-hvac", null, "development")).get("health"));

        Assertions.assertEquals("RED", health.get("overall"));
        Assertions.assertEquals(List.of("NO_ACTIVE_SCENARIOS"), codes(health.get("criticalIssues")));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<String> codes(Object issues) {
        return ((List<Map<String, Object>>) issues).stream()
                .map(issue -> String.valueOf(issue.get("code")))
                .collect(Collectors.toList());
    }
}
