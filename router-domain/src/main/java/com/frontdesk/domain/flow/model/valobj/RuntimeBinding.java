package com.frontdesk.domain.flow.model.valobj;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 运行时埋点到流程节点的映射。
 * <p>
 * 运行时各处打出的检查点、matchSource、日志片段和事件名，只能通过这里归一到节点 id。
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeBinding(String nodeId,
                             List<String> checkpoints,
                             List<String> matchSources,
                             List<String> codePatterns,
                             List<String> events,
                             String note) {

    public RuntimeBinding {
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        matchSources = matchSources == null ? List.of() : List.copyOf(matchSources);
        codePatterns = codePatterns == null ? List.of() : List.copyOf(codePatterns);
        events = events == null ? null : List.copyOf(events);
    }
}
