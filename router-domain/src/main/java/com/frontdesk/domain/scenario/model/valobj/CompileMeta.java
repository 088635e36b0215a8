package com.frontdesk.domain.scenario.model.valobj;

/**
 * 编译元数据。
 *
 * @param compiledAt 编译时间（epoch ms）
 * @param compileTimeMs 编译耗时
 * @param triggerCount 规范化后的触发词数量
 * @param replyCount quick + full 回复数量
 * @param hasNoNameVariants 是否存在无姓名回复变体
 */
public record CompileMeta(long compiledAt,
                          long compileTimeMs,
                          int triggerCount,
                          int replyCount,
                          boolean hasNoNameVariants) {
}
