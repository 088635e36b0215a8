package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 候选检索结果 DTO（诊断用）。
 */
@Data
public class CandidateLookupResponseDTO {

    private String companyId;
    private Long poolVersion;
    private String query;
    private String method;
    private String exactMatchId;
    private List<ScenarioCandidateDTO> candidates;
    private RuntimeTraceDTO trace;
}
