package com.frontdesk.domain.truth.model.valobj;

/**
 * 运行时每回合上报的决策信号，三个字段都可以为空。
 */
public record RuntimeFlowState(String matchSource, String checkpoint, String branchTaken) {
}
