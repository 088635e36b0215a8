package com.frontdesk.trigger.application.query;

import com.frontdesk.api.dto.CandidateLookupResponseDTO;
import com.frontdesk.api.dto.ScenarioCandidateDTO;
import com.frontdesk.domain.scenario.model.valobj.CandidateLookupResult;
import com.frontdesk.domain.scenario.model.valobj.MatchInfo;
import com.frontdesk.domain.scenario.model.valobj.RegexTrigger;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.RuntimeTrace;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.model.valobj.TurnTimings;
import com.frontdesk.domain.scenario.service.CandidateLookupDomainService;
import com.frontdesk.domain.scenario.service.RuntimeTraceDomainService;
import com.frontdesk.domain.scenario.service.SafeRegexCompiler;
import com.frontdesk.domain.scenario.service.ScenarioCompileDomainService;
import com.frontdesk.domain.scenario.service.ScenarioPoolRegistry;
import com.frontdesk.trigger.application.common.ScenarioPoolViewAssembler;
import com.frontdesk.types.enums.MatchMethodEnum;
import com.frontdesk.types.enums.ResponseCode;
import com.frontdesk.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 候选检索诊断读用例：在已发布的场景池上检索并生成一条 runtime trace。
 * <p>
 * 这里没有下游打分器，exact 命中记为置信度 1.0，其余方式取第一个候选、置信度记 0。
 * </p>
 */
@Service
public class ScenarioLookupQueryService {

    private final ScenarioPoolRegistry scenarioPoolRegistry;
    private final CandidateLookupDomainService candidateLookupDomainService;
    private final RuntimeTraceDomainService runtimeTraceDomainService;
    private final SafeRegexCompiler safeRegexCompiler;

    public ScenarioLookupQueryService(ScenarioPoolRegistry scenarioPoolRegistry,
                                      CandidateLookupDomainService candidateLookupDomainService,
                                      RuntimeTraceDomainService runtimeTraceDomainService,
                                      SafeRegexCompiler safeRegexCompiler) {
        this.scenarioPoolRegistry = scenarioPoolRegistry;
        this.candidateLookupDomainService = candidateLookupDomainService;
        this.runtimeTraceDomainService = runtimeTraceDomainService;
        this.safeRegexCompiler = safeRegexCompiler;
    }

    public CandidateLookupResponseDTO lookup(String companyId, String query) {
        ScenarioPool pool = scenarioPoolRegistry.current(companyId)
                .orElseThrow(() -> new AppException(ResponseCode.POOL_NOT_FOUND, "场景池未发布: " + companyId));

        long startNanos = System.nanoTime();
        CandidateLookupResult result = candidateLookupDomainService.lookup(query, pool);
        long matchMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        RuntimeSpec matched = result.exactMatch() != null
                ? result.exactMatch()
                : result.candidates().isEmpty() ? null : result.candidates().get(0);
        MatchInfo matchInfo = MatchInfo.builder()
                .companyId(pool.companyId())
                .method(result.method() == null ? null : result.method().getCode())
                .confidence(result.method() == MatchMethodEnum.EXACT ? 1.0D : 0D)
                .tier(0)
                .build();
        RuntimeTrace trace = runtimeTraceDomainService.buildTrace(matched, matchInfo,
                new TurnTimings(matchMs, 0L, 0L, matchMs));
        runtimeTraceDomainService.logTrace(trace);

        CandidateLookupResponseDTO dto = new CandidateLookupResponseDTO();
        dto.setCompanyId(pool.companyId());
        dto.setPoolVersion(pool.version());
        dto.setQuery(query);
        dto.setMethod(result.method() == null ? null : result.method().getCode());
        dto.setExactMatchId(result.exactMatch() == null ? null : result.exactMatch().id());
        List<ScenarioCandidateDTO> candidates = new ArrayList<>();
        for (RuntimeSpec candidate : result.candidates()) {
            ScenarioCandidateDTO candidateDTO = ScenarioPoolViewAssembler.toCandidateDTO(candidate);
            candidateDTO.setRegexMatched(matchRegexTriggers(candidate, query));
            candidates.add(candidateDTO);
        }
        dto.setCandidates(candidates);
        dto.setTrace(ScenarioPoolViewAssembler.toTraceDTO(trace));
        return dto;
    }

    /**
     * 正则触发词不参与候选检索，只在诊断结果中标出，供下游打分器对照。
     */
    private List<String> matchRegexTriggers(RuntimeSpec candidate, String query) {
        List<String> matched = new ArrayList<>();
        String normalized = ScenarioCompileDomainService.normalize(query);
        for (RegexTrigger trigger : candidate.triggers().regex()) {
            if (safeRegexCompiler.matches(trigger, normalized)) {
                matched.add(trigger.getSource());
            }
        }
        return matched;
    }
}
