package com.frontdesk.infrastructure.gateway.wiring;

import com.frontdesk.domain.scenario.model.valobj.RuntimeSpec;
import com.frontdesk.domain.scenario.model.valobj.ScenarioPool;
import com.frontdesk.domain.scenario.model.valobj.TriggerConflict;
import com.frontdesk.domain.scenario.service.ScenarioPoolRegistry;
import com.frontdesk.domain.truth.adapter.gateway.IWiringReportGenerator;
import com.frontdesk.types.enums.ActionTypeEnum;
import com.frontdesk.types.enums.FollowUpModeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 基于已发布场景池的接线报告。
 * <p>
 * 报告只读取注册表中的快照：场景池未发布为关键问题（RED），
 * 遮蔽触发词、缺少 flowId 的流程动作、无法识别的枚举值为警告（YELLOW）。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Slf4j
@Component
public class ScenarioPoolWiringReportGenerator implements IWiringReportGenerator {

    static final String HEALTH_GREEN = "GREEN";
    static final String HEALTH_YELLOW = "YELLOW";
    static final String HEALTH_RED = "RED";

    private final ScenarioPoolRegistry scenarioPoolRegistry;

    public ScenarioPoolWiringReportGenerator(ScenarioPoolRegistry scenarioPoolRegistry) {
        this.scenarioPoolRegistry = scenarioPoolRegistry;
    }

    @Override
    public Object generate(String companyId, Map<String, Object> company, String environment) {
        List<Map<String, Object>> criticalIssues = new ArrayList<>();
        List<Map<String, Object>> warnings = new ArrayList<>();
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("companyId", companyId);
        report.put("environment", environment);
        report.put("companyDocumentProvided", company != null && !company.isEmpty());

        Optional<ScenarioPool> current = scenarioPoolRegistry.current(companyId);
        if (current.isEmpty()) {
            criticalIssues.add(issue("SCENARIO_POOL_NOT_PUBLISHED", "No scenario pool published for company", null));
            report.put("scenarioPool", Map.of("published", false));
        } else {
            ScenarioPool pool = current.get();
            report.put("scenarioPool", describePool(pool));
            report.put("needsUsage", countNeeds(pool.specs()));
            inspectSpecs(pool.specs(), criticalIssues, warnings);
            for (TriggerConflict conflict : pool.conflicts()) {
                warnings.add(issue("TRIGGER_SHADOWED",
                        "Trigger '" + conflict.trigger() + "' of " + conflict.shadowedScenarioId()
                                + " is shadowed by " + conflict.winnerScenarioId(),
                        conflict.shadowedScenarioId()));
            }
        }

        String overall = !criticalIssues.isEmpty() ? HEALTH_RED : !warnings.isEmpty() ? HEALTH_YELLOW : HEALTH_GREEN;
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("overall", overall);
        health.put("criticalIssues", criticalIssues);
        health.put("warnings", warnings);
        report.put("health", health);
        log.info("WIRING_REPORT_BUILT companyId={}, overall={}, criticalIssues={}, warnings={}",
                companyId, overall, criticalIssues.size(), warnings.size());
        return report;
    }

    private static Map<String, Object> describePool(ScenarioPool pool) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("published", true);
        summary.put("version", pool.version());
        summary.put("builtAt", pool.builtAt());
        summary.put("activeScenarios", pool.stats().activeScenarios());
        summary.put("inactiveScenarios", pool.stats().inactiveScenarios());
        summary.put("totalTriggers", pool.stats().totalTriggers());
        summary.put("exactIndexSize", pool.stats().exactIndexSize());
        summary.put("indexSize", pool.stats().indexSize());
        summary.put("shadowedTriggers", pool.stats().shadowedTriggers());
        return summary;
    }

    private static Map<String, Integer> countNeeds(List<RuntimeSpec> specs) {
        Map<String, Integer> usage = new TreeMap<>();
        for (RuntimeSpec spec : specs) {
            for (String setting : spec.needs().enabledSettings()) {
                usage.merge(setting, 1, Integer::sum);
            }
        }
        return usage;
    }

    private static void inspectSpecs(List<RuntimeSpec> specs,
                                     List<Map<String, Object>> criticalIssues,
                                     List<Map<String, Object>> warnings) {
        if (specs.isEmpty()) {
            criticalIssues.add(issue("NO_ACTIVE_SCENARIOS", "Scenario pool has no active scenarios", null));
            return;
        }
        for (RuntimeSpec spec : specs) {
            if (spec.triggers().normalized().isEmpty() && spec.triggers().regex().isEmpty()) {
                warnings.add(issue("SCENARIO_UNREACHABLE", "Active scenario has no usable triggers", spec.id()));
            }
            if (spec.replies().quick().isEmpty() && spec.replies().full().isEmpty()) {
                warnings.add(issue("SCENARIO_NO_REPLIES", "Active scenario has no replies", spec.id()));
            }
            if (spec.wiring().actionType() == ActionTypeEnum.START_FLOW && spec.wiring().flowId() == null) {
                warnings.add(issue("FLOW_ID_MISSING", "START_FLOW scenario has no flowId", spec.id()));
            }
            if (spec.wiring().actionType() == ActionTypeEnum.UNKNOWN) {
                warnings.add(issue("ACTION_TYPE_UNKNOWN", "Unrecognized actionType", spec.id()));
            }
            if (spec.followUp().mode() == FollowUpModeEnum.UNKNOWN) {
                warnings.add(issue("FOLLOW_UP_MODE_UNKNOWN", "Unrecognized followUpMode", spec.id()));
            }
            if (spec.followUp().mode() == FollowUpModeEnum.TRANSFER && spec.followUp().transferTarget() == null) {
                warnings.add(issue("TRANSFER_TARGET_MISSING", "TRANSFER follow-up has no transferTarget", spec.id()));
            }
        }
    }

    private static Map<String, Object> issue(String code, String message, String scenarioId) {
        Map<String, Object> issue = new LinkedHashMap<>();
        issue.put("code", code);
        issue.put("message", message);
        if (scenarioId != null) {
            issue.put("scenarioId", scenarioId);
        }
        return issue;
    }
}
