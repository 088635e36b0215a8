package com.frontdesk.domain.flow.model.valobj;

import java.util.List;

/**
 * 流程树导出结构。
 */
public record FlowTree(String version,
                       List<FlowNode> nodes,
                       List<FlowEdge> edges,
                       String entryNodeId,
                       String exitNodeId,
                       int nodeCount,
                       int edgeCount) {
}
