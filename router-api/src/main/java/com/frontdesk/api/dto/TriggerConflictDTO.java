package com.frontdesk.api.dto;

import lombok.Data;

/**
 * 被遮蔽触发词 DTO。
 */
@Data
public class TriggerConflictDTO {

    private String trigger;
    private String winnerScenarioId;
    private String shadowedScenarioId;
}
