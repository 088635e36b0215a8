package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 候选场景摘要 DTO。
 */
@Data
public class ScenarioCandidateDTO {

    private String scenarioId;
    private String name;
    private String scenarioType;
    private Integer priority;
    private Double minConfidence;
    /** 在匹配预算内命中本次输入的正则触发词原文 */
    private List<String> regexMatched;
}
