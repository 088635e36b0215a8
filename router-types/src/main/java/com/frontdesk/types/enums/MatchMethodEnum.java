package com.frontdesk.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 候选检索命中方式。
 */
public enum MatchMethodEnum {

    /**
     * 规范化输入与触发词完全一致。
     */
    EXACT("exact"),

    /**
     * 输入包含某个长度不小于 5 的触发词。
     */
    CONTAINS("contains"),

    /**
     * 词索引兜底召回。
     */
    WORD_INDEX("word_index");

    private final String code;

    MatchMethodEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static MatchMethodEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (MatchMethodEnum value : MatchMethodEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown match method: " + text);
    }
}
