package com.frontdesk.domain.truth.model.valobj;

import com.frontdesk.domain.flow.model.valobj.FlowEdge;

import java.util.List;

/**
 * 导出时对流程图做的结构校验结果。
 */
public record BundleValidation(List<String> unreachableNodes,
                               List<FlowEdge> invalidEdges,
                               List<String> validMatchSources) {
}
