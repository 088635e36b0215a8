package com.frontdesk.domain.scenario.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 未经解释的 Tier 2/3 配置原文。
 * <p>
 * 只在对应的 {@link NeedsFlags} 为 true 时由 Tier 2 逻辑读取，热路径不访问。
 * </p>
 */
public record RawPayload(List<Object> preconditions,
                         List<Object> entityCapture,
                         Map<String, Object> entityValidation,
                         Map<String, Object> dynamicVariables,
                         List<Object> actionHooks,
                         List<Object> effects,
                         Map<String, Object> ttsOverride,
                         Map<String, Object> timedFollowUp,
                         Map<String, Object> silencePolicy) {
}
