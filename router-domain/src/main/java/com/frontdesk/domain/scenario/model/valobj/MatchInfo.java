package com.frontdesk.domain.scenario.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 下游打分阶段给出的命中信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchInfo {

    private String companyId;
    private String method;
    private Double confidence;
    private Integer tier;
    private String replyType;
    private Integer replyIndex;
}
