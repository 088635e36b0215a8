package com.frontdesk.types.enums;

/**
 * 回复策略枚举。
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public enum ReplyStrategyEnum {

    AUTO,
    FULL_ONLY,
    QUICK_ONLY,
    QUICK_THEN_FULL,

    /**
     * Tier-3：LLM 包装改写固定回复。
     */
    LLM_WRAP,

    /**
     * Tier-3：固定回复作为 LLM 上下文。
     */
    LLM_CONTEXT;

    public boolean isLlmRewrite() {
        return this == LLM_WRAP || this == LLM_CONTEXT;
    }

    public static ReplyStrategyEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return AUTO;
        }
        String normalized = text.trim();
        for (ReplyStrategyEnum value : ReplyStrategyEnum.values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return AUTO;
    }
}
