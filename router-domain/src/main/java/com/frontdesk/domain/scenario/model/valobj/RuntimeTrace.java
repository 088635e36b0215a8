package com.frontdesk.domain.scenario.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 单回合场景决策的轻量观测记录。
 * <p>
 * {@code appliedSettings} 记录本回合实际启用的分级设置，便于审计。
 * </p>
 */
public record RuntimeTrace(String companyId,
                           String templateId,
                           String scenarioIdMatched,
                           String scenarioNameMatched,
                           String matchMethod,
                           double matchConfidence,
                           int matchTier,
                           String replyType,
                           int replyIndex,
                           List<String> appliedSettings,
                           TurnTimings latencyBreakdownMs,
                           Map<String, Boolean> needsEvaluated,
                           long timestamp) {
}
