package com.frontdesk.trigger.application.query;

import com.frontdesk.api.dto.FlowTreeResponseDTO;
import com.frontdesk.api.dto.PathCheckRequestDTO;
import com.frontdesk.api.dto.PathCheckResponseDTO;
import com.frontdesk.domain.flow.model.aggregate.FlowGraph;
import com.frontdesk.domain.flow.model.valobj.FlowEdge;
import com.frontdesk.domain.truth.model.valobj.OutOfTreeWarning;
import com.frontdesk.domain.truth.model.valobj.PathCheckResult;
import com.frontdesk.domain.truth.model.valobj.RuntimeFlowState;
import com.frontdesk.domain.truth.service.TruthBundleExporter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 流程树查询与运行时路径判定。
 */
@Service
public class FlowTreeQueryService {

    private final TruthBundleExporter truthBundleExporter;

    public FlowTreeQueryService(TruthBundleExporter truthBundleExporter) {
        this.truthBundleExporter = truthBundleExporter;
    }

    public FlowTreeResponseDTO getFlowTree() {
        FlowGraph graph = truthBundleExporter.getFlowGraph();
        FlowTreeResponseDTO dto = new FlowTreeResponseDTO();
        dto.setFlowTree(graph.exportFlowTree());
        dto.setRuntimeBindings(graph.exportRuntimeBindings());
        dto.setValidMatchSources(graph.getValidMatchSources());
        dto.setConditionVariables(graph.getConditionVariables());
        dto.setUnreachableNodes(graph.findUnreachableNodes());
        dto.setInvalidEdgeIds(edgeIds(graph.findInvalidEdges()));
        dto.setInvalidPredicateEdgeIds(edgeIds(graph.findInvalidPredicates()));
        return dto;
    }

    public PathCheckResponseDTO checkPath(PathCheckRequestDTO request) {
        RuntimeFlowState state = request == null
                ? new RuntimeFlowState(null, null, null)
                : new RuntimeFlowState(request.getMatchSource(), request.getCheckpoint(), request.getBranchTaken());
        PathCheckResult result = truthBundleExporter.checkPathInTree(state);
        PathCheckResponseDTO dto = new PathCheckResponseDTO();
        dto.setInTree(result.inTree());
        dto.setFlowNodeId(result.flowNodeId());
        dto.setWarning(toWarningDTO(result.warning()));
        return dto;
    }

    private PathCheckResponseDTO.OutOfTreeWarningDTO toWarningDTO(OutOfTreeWarning warning) {
        if (warning == null) {
            return null;
        }
        PathCheckResponseDTO.OutOfTreeWarningDTO dto = new PathCheckResponseDTO.OutOfTreeWarningDTO();
        dto.setType(warning.type());
        dto.setMatchSource(warning.matchSource());
        dto.setCheckpoint(warning.checkpoint());
        dto.setBranchTaken(warning.branchTaken());
        dto.setMessage(warning.message());
        return dto;
    }

    private List<String> edgeIds(List<FlowEdge> edges) {
        return edges.stream().map(FlowEdge::id).collect(Collectors.toList());
    }
}
