package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 运行时 trace DTO。
 */
@Data
public class RuntimeTraceDTO {

    private String companyId;
    private String templateId;
    private String scenarioIdMatched;
    private String scenarioNameMatched;
    private String matchMethod;
    private Double matchConfidence;
    private Integer matchTier;
    private String replyType;
    private Integer replyIndex;
    private List<String> appliedSettings;
    private Map<String, Long> latencyBreakdownMs;
    private Map<String, Boolean> needsEvaluated;
    private Long timestamp;
}
