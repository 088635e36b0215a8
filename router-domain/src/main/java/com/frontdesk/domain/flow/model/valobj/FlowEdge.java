package com.frontdesk.domain.flow.model.valobj;

/**
 * 流程树有向边。
 *
 * @param when 原始条件文本
 * @param condition 解析后的条件结构；只用于检查与导出，不会被执行
 */
public record FlowEdge(String id, String from, String to, String when, FlowPredicate condition) {
}
