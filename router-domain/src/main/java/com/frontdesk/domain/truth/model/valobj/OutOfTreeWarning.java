package com.frontdesk.domain.truth.model.valobj;

/**
 * 运行时决策无法映射到流程图节点时产生的告警。
 */
public record OutOfTreeWarning(String type,
                               String matchSource,
                               String checkpoint,
                               String branchTaken,
                               String message) {
}
