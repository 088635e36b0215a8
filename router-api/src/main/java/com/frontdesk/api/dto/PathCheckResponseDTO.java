package com.frontdesk.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 运行时路径判定结果 DTO。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PathCheckResponseDTO {

    private Boolean inTree;
    private String flowNodeId;
    private OutOfTreeWarningDTO warning;

    @Data
    public static class OutOfTreeWarningDTO {

        private String type;
        private String matchSource;
        private String checkpoint;
        private String branchTaken;
        private String message;
    }
}
