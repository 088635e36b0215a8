package com.frontdesk.domain.flow.model.valobj;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.frontdesk.types.enums.FlowNodeTypeEnum;

import java.util.List;

/**
 * 流程树节点：一个合法的运行时决策点。
 *
 * @param checkpoint 代码中埋点使用的检查点标识
 * @param configPaths 影响该节点行为的配置路径
 * @param matchSource 节点对应的主 matchSource 标签
 * @param tier 节点所在的处理层级（如 tier3）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowNode(String id,
                       String label,
                       FlowNodeTypeEnum type,
                       String description,
                       String checkpoint,
                       List<String> configPaths,
                       String codeLocation,
                       String matchSource,
                       String tier,
                       String note) {

    public FlowNode {
        configPaths = configPaths == null ? null : List.copyOf(configPaths);
    }

    public static FlowNode of(String id, String label, FlowNodeTypeEnum type, String description, String checkpoint) {
        return new FlowNode(id, label, type, description, checkpoint, null, null, null, null, null);
    }

    public FlowNode withConfigPaths(String... paths) {
        return new FlowNode(id, label, type, description, checkpoint, List.of(paths), codeLocation, matchSource, tier, note);
    }

    public FlowNode withCodeLocation(String location) {
        return new FlowNode(id, label, type, description, checkpoint, configPaths, location, matchSource, tier, note);
    }

    public FlowNode withMatchSource(String source) {
        return new FlowNode(id, label, type, description, checkpoint, configPaths, codeLocation, source, tier, note);
    }

    public FlowNode withTier(String value) {
        return new FlowNode(id, label, type, description, checkpoint, configPaths, codeLocation, matchSource, value, note);
    }

    public FlowNode withNote(String value) {
        return new FlowNode(id, label, type, description, checkpoint, configPaths, codeLocation, matchSource, tier, value);
    }
}
