package com.frontdesk.domain.scenario.model.valobj;

import java.util.List;

/**
 * 编译后的触发素材。
 *
 * @param original 审计用原始触发词
 * @param normalized 小写、去首尾空白、长度不小于 2 的触发词（不去重）
 * @param regex 通过安全检查的正则触发词
 * @param negative 规范化后的否定触发词
 * @param examples 规范化后的示例说法
 * @param negativeExamples 规范化后的反例说法
 */
public record TriggerSet(List<String> original,
                         List<String> normalized,
                         List<RegexTrigger> regex,
                         List<String> negative,
                         List<String> examples,
                         List<String> negativeExamples) {
}
