package com.frontdesk.domain.scenario.model.valobj;

import java.util.List;

/**
 * 一次完整编译得到的场景池快照。
 * <p>
 * 快照整体构建完成后才会被发布，发布后不再修改；重建总是产生新的快照。
 * </p>
 */
public record ScenarioPool(String companyId,
                           long version,
                           long builtAt,
                           List<RuntimeSpec> specs,
                           ExactIndex exactIndex,
                           WordIndex wordIndex,
                           PoolStats stats,
                           List<TriggerConflict> conflicts) {

    public ScenarioPool withIdentity(String companyId, long version) {
        return new ScenarioPool(companyId, version, builtAt, specs, exactIndex, wordIndex, stats, conflicts);
    }
}
