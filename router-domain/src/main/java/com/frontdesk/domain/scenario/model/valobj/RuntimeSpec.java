package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.enums.ScenarioTypeEnum;

/**
 * 编译后的场景运行时规格，构建后不可变。
 */
public record RuntimeSpec(String id,
                          String name,
                          String templateId,
                          String categoryName,
                          boolean active,
                          String status,
                          ScenarioTypeEnum scenarioType,
                          int priority,
                          double minConfidence,
                          int cooldownSeconds,
                          TriggerSet triggers,
                          ReplySet replies,
                          FollowUpSpec followUp,
                          WiringSpec wiring,
                          String behavior,
                          String channel,
                          String handoffPolicy,
                          NeedsFlags needs,
                          RawPayload raw,
                          CompileMeta meta) {

    public RuntimeSpec withId(String newId) {
        return new RuntimeSpec(newId, name, templateId, categoryName, active, status, scenarioType, priority,
                minConfidence, cooldownSeconds, triggers, replies, followUp, wiring, behavior, channel,
                handoffPolicy, needs, raw, meta);
    }
}
