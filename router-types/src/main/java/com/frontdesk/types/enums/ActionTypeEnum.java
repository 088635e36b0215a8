package com.frontdesk.types.enums;

/**
 * 场景命中后的动作类型。
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public enum ActionTypeEnum {

    /** 仅回复（FAQ、闲聊） */
    REPLY_ONLY,

    /** 启动动态流程，需要 flowId */
    START_FLOW,

    /** 锁定进入预约收集模式 */
    REQUIRE_BOOKING,

    /** 立即转接 */
    TRANSFER,

    /** 发送短信跟进 */
    SMS_FOLLOWUP,

    /** 无法识别的配置值 */
    UNKNOWN;

    public static ActionTypeEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return REPLY_ONLY;
        }
        String normalized = text.trim();
        for (ActionTypeEnum value : ActionTypeEnum.values()) {
            if (value != UNKNOWN && value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
