package com.frontdesk.domain.scenario.model.valobj;

/**
 * 场景池编译统计，构建过程中累加得到。
 */
public record PoolStats(int totalScenarios,
                        int activeScenarios,
                        int inactiveScenarios,
                        int totalTriggers,
                        int totalReplies,
                        int exactIndexSize,
                        int indexSize,
                        int shadowedTriggers,
                        long compileTimeMs) {
}
