package com.frontdesk.trigger.application.common;

import com.frontdesk.api.dto.PoolRebuildResponseDTO;
import com.frontdesk.api.dto.PoolStatsDTO;
import com.frontdesk.api.dto.RuntimeTraceDTO;
import com.frontdesk.api.dto.ScenarioCandidateDTO;
import com.frontdesk.api.dto.TriggerConflictDTO;
import com.frontdesk.domain.scenario.model.valobj.PoolStats;
import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.RuntimeTrace;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.model.valobj.TriggerConflict;
import com.frontdesk.domain.scenario.model.valobj.TurnTimings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 场景池相关领域对象到 API DTO 的组装。
 */
public final class ScenarioPoolViewAssembler {

    private ScenarioPoolViewAssembler() {
    }

    public static PoolRebuildResponseDTO toRebuildDTO(ScenarioPool pool) {
        PoolRebuildResponseDTO dto = new PoolRebuildResponseDTO();
        dto.setCompanyId(pool.companyId());
        dto.setVersion(pool.version());
        dto.setBuiltAt(pool.builtAt());
        dto.setTemplateId(pool.specs().isEmpty() ? null : pool.specs().get(0).templateId());
        dto.setStats(toStatsDTO(pool.stats()));
        dto.setConflicts(pool.conflicts() == null
                ? Collections.emptyList()
                : pool.conflicts().stream().map(ScenarioPoolViewAssembler::toConflictDTO).collect(Collectors.toList()));
        return dto;
    }

    public static PoolStatsDTO toStatsDTO(PoolStats stats) {
        if (stats == null) {
            return null;
        }
        PoolStatsDTO dto = new PoolStatsDTO();
        dto.setTotalScenarios(stats.totalScenarios());
        dto.setActiveScenarios(stats.activeScenarios());
        dto.setInactiveScenarios(stats.inactiveScenarios());
        dto.setTotalTriggers(stats.totalTriggers());
        dto.setTotalReplies(stats.totalReplies());
        dto.setExactIndexSize(stats.exactIndexSize());
        dto.setIndexSize(stats.indexSize());
        dto.setShadowedTriggers(stats.shadowedTriggers());
        dto.setCompileTimeMs(stats.compileTimeMs());
        return dto;
    }

    public static TriggerConflictDTO toConflictDTO(TriggerConflict conflict) {
        TriggerConflictDTO dto = new TriggerConflictDTO();
        dto.setTrigger(conflict.trigger());
        dto.setWinnerScenarioId(conflict.winnerScenarioId());
        dto.setShadowedScenarioId(conflict.shadowedScenarioId());
        return dto;
    }

    public static ScenarioCandidateDTO toCandidateDTO(RuntimeSpec spec) {
        ScenarioCandidateDTO dto = new ScenarioCandidateDTO();
        dto.setScenarioId(spec.id());
        dto.setName(spec.name());
        dto.setScenarioType(spec.scenarioType() == null ? null : spec.scenarioType().name());
        dto.setPriority(spec.priority());
        dto.setMinConfidence(spec.minConfidence());
        return dto;
    }

    public static RuntimeTraceDTO toTraceDTO(RuntimeTrace trace) {
        RuntimeTraceDTO dto = new RuntimeTraceDTO();
        dto.setCompanyId(trace.companyId());
        dto.setTemplateId(trace.templateId());
        dto.setScenarioIdMatched(trace.scenarioIdMatched());
        dto.setScenarioNameMatched(trace.scenarioNameMatched());
        dto.setMatchMethod(trace.matchMethod());
        dto.setMatchConfidence(trace.matchConfidence());
        dto.setMatchTier(trace.matchTier());
        dto.setReplyType(trace.replyType());
        dto.setReplyIndex(trace.replyIndex());
        dto.setAppliedSettings(trace.appliedSettings());
        dto.setLatencyBreakdownMs(toLatencyMap(trace.latencyBreakdownMs()));
        dto.setNeedsEvaluated(trace.needsEvaluated());
        dto.setTimestamp(trace.timestamp());
        return dto;
    }

    private static Map<String, Long> toLatencyMap(TurnTimings timings) {
        TurnTimings latency = timings == null ? TurnTimings.ZERO : timings;
        Map<String, Long> map = new LinkedHashMap<>();
        map.put("match", latency.match());
        map.put("render", latency.render());
        map.put("tts", latency.tts());
        map.put("total", latency.total());
        return map;
    }
}
