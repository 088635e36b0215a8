package com.frontdesk.types.enums;

/**
 * 回复后的跟进方式。
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public enum FollowUpModeEnum {

    NONE,
    ASK_FOLLOWUP_QUESTION,
    ASK_IF_BOOK,
    TRANSFER,

    /**
     * 配置值无法识别，运行时按 NONE 处理但保留可审计的标记。
     */
    UNKNOWN;

    public static FollowUpModeEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return NONE;
        }
        String normalized = text.trim();
        for (FollowUpModeEnum value : FollowUpModeEnum.values()) {
            if (value != UNKNOWN && value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
