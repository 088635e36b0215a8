package com.frontdesk.api.dto;

import lombok.Data;

/**
 * 场景池编译统计 DTO。
 */
@Data
public class PoolStatsDTO {

    private Integer totalScenarios;
    private Integer activeScenarios;
    private Integer inactiveScenarios;
    private Integer totalTriggers;
    private Integer totalReplies;
    private Integer exactIndexSize;
    private Integer indexSize;
    private Integer shadowedTriggers;
    private Long compileTimeMs;
}
