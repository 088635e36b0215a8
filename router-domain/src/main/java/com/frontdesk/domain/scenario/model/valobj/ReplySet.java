package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.enums.ReplyStrategyEnum;

import java.util.List;

/**
 * 编译后的回复集合，四组回复均已剔除空白项。
 */
public record ReplySet(List<String> quick,
                       List<String> full,
                       List<String> quickNoName,
                       List<String> fullNoName,
                       ReplyStrategyEnum strategy) {
}
