package com.frontdesk.types.enums;

/**
 * 场景分类枚举。
 * <p>
 * 未知或缺失的分类统一回退为 {@link #FAQ}。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public enum ScenarioTypeEnum {

    EMERGENCY,
    BOOKING,
    FAQ,
    TROUBLESHOOT,
    BILLING,
    TRANSFER,
    SMALL_TALK,
    SYSTEM;

    public static ScenarioTypeEnum fromText(String text) {
        if (text == null) {
            return FAQ;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return FAQ;
        }
        for (ScenarioTypeEnum value : ScenarioTypeEnum.values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return FAQ;
    }
}
