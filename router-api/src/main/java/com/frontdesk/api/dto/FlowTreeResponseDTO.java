package com.frontdesk.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 流程树导出 DTO：流程树与运行时绑定保持导出时的 JSON 结构。
 */
@Data
public class FlowTreeResponseDTO {

    private Object flowTree;
    private Object runtimeBindings;
    private List<String> validMatchSources;
    private List<String> conditionVariables;
    private List<String> unreachableNodes;
    private List<String> invalidEdgeIds;
    private List<String> invalidPredicateEdgeIds;
}
