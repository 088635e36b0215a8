package com.frontdesk.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 流程树节点类型。
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public enum FlowNodeTypeEnum {

    /** 通话入口 */
    ENTRY("entry"),

    /** 校验/拦截 */
    GUARD("guard"),

    /** 意图/模式识别 */
    DETECTOR("detector"),

    /** 分支判定 */
    DECISION("decision"),

    /** 动作 */
    ACTION("action"),

    /** 路由到子系统 */
    ROUTER("router"),

    /** 回合结束 */
    EXIT("exit");

    private final String code;

    FlowNodeTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static FlowNodeTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (FlowNodeTypeEnum value : FlowNodeTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown flow node type: " + text);
    }
}
