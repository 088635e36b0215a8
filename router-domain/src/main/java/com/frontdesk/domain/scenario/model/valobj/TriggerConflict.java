package com.frontdesk.domain.scenario.model.valobj;

/**
 * 同一字面触发词被多个场景注册时的遮蔽记录，供运营排查。
 */
public record TriggerConflict(String trigger,
                              String winnerScenarioId,
                              String shadowedScenarioId) {
}
