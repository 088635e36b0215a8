package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 场景池重建结果 DTO。
 */
@Data
public class PoolRebuildResponseDTO {

    private String companyId;
    private Long version;
    private Long builtAt;
    private String templateId;
    private PoolStatsDTO stats;
    private List<TriggerConflictDTO> conflicts;
}
