package com.frontdesk.test.domain;

import com.frontdesk.domain.scenario.model.valobj.CandidateLookupResult;
import com.frontdesk.domain.scenario.model.valobj.CompileOptions;
import com.frontdesk.domain.scenario.model.valobj.RawScenario;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.service.CandidateLookupDomainService;
import com.frontdesk.test.support.ScenarioFixtures;
import com.frontdesk.types.enums.MatchMethodEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class CandidateLookupDomainServiceTest {

    private final CandidateLookupDomainService service = ScenarioFixtures.lookup();

    @Test
    public void shouldReturnExactMatchForNoHeat() {
        ScenarioPool pool = ScenarioFixtures.poolCompiler()
                .compilePool(List.of(ScenarioFixtures.noHeat()), CompileOptions.none());

        CandidateLookupResult result = service.lookup("no heat", pool);

        Assertions.assertEquals(MatchMethodEnum.EXACT, result.method());
        Assertions.assertNotNull(result.exactMatch());
        Assertions.assertEquals("no_heat", result.exactMatch().id());
        Assertions.assertEquals(List.of(result.exactMatch()), result.candidates());
    }

    @Test
    public void shouldPreferExactOverFuzzyMatches() {
        ScenarioPool pool = ScenarioFixtures.poolCompiler().compilePool(List.of(
                ScenarioFixtures.scenario("heater_noise", "heater making noise"),
                ScenarioFixtures.scenario("heater", "heater")), CompileOptions.none());

        CandidateLookupResult result = service.lookup("  HEATER ", pool);

        Assertions.assertEquals(MatchMethodEnum.EXACT, result.method());
        Assertions.assertEquals("heater", result.exactMatch().id());
    }

    @Test
    public void shouldMatchContainedTriggerOfAtLeastFiveChars() {
        ScenarioPool pool = ScenarioFixtures.poolCompiler().compilePool(List.of(
                ScenarioFixtures.scenario("short", "ac"),
                ScenarioFixtures.scenario("gas", "gas leak")), CompileOptions.none());

        CandidateLookupResult contains = service.lookup("i think there is a gas leak here", pool);
        Assertions.assertEquals(MatchMethodEnum.CONTAINS, contains.method());
        Assertions.assertNull(contains.exactMatch());
        Assertions.assertEquals("gas", contains.candidates().get(0).id());

        CandidateLookupResult tooShort = service.lookup("my ac unit", pool);
        Assertions.assertEquals(MatchMethodEnum.WORD_INDEX, tooShort.method());
        Assertions.assertTrue(tooShort.candidates().isEmpty());
    }

    @Test
    public void shouldRankWordCandidatesByScoreKeepingFirstSeenOrderOnTies() {
        ScenarioPool pool = ScenarioFixtures.poolCompiler().compilePool(List.of(
                ScenarioFixtures.scenario("furnace", "furnace smells"),
                ScenarioFixtures.scenario("furnace_noise", "furnace noise loud"),
                ScenarioFixtures.scenario("noise", "loud noise")), CompileOptions.none());

        CandidateLookupResult result = service.lookup("loud furnace noise", pool);

        Assertions.assertEquals(MatchMethodEnum.WORD_INDEX, result.method());
        Assertions.assertEquals(List.of("furnace_noise", "noise", "furnace"),
                result.candidates().stream().map(RuntimeSpec::id).collect(Collectors.toList()));
    }

    @Test
    public void shouldNeverReturnMoreThanTwentyCandidates() {
        List<RawScenario> scenarios = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            scenarios.add(ScenarioFixtures.scenario("boiler_" + i, "boiler issue " + i));
        }
        ScenarioPool pool = ScenarioFixtures.poolCompiler().compilePool(scenarios, CompileOptions.none());

        CandidateLookupResult result = service.lookup("boiler trouble", pool);

        Assertions.assertEquals(CandidateLookupDomainService.MAX_CANDIDATES, result.candidates().size());
        Assertions.assertEquals("boiler_0", result.candidates().get(0).id());
    }

    @Test
    public void shouldReturnEmptyWordIndexResultForBlankInput() {
        ScenarioPool pool = ScenarioFixtures.poolCompiler()
                .compilePool(List.of(ScenarioFixtures.noHeat()), CompileOptions.none());

        for (String input : new String[]{null, "", "   "}) {
            CandidateLookupResult result = service.lookup(input, pool);
            Assertions.assertEquals(MatchMethodEnum.WORD_INDEX, result.method());
            Assertions.assertNull(result.exactMatch());
            Assertions.assertTrue(result.candidates().isEmpty());
        }
    }
}
