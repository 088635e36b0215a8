package com.frontdesk.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 场景池未发布 */
    POOL_NOT_FOUND("0101", "场景池不存在"),

    /** 场景源读取失败 */
    SCENARIO_SOURCE_ERROR("0102", "场景源读取失败"),

    /** Truth Bundle 导出失败 */
    TRUTH_BUNDLE_FAILED("0201", "Truth Bundle 导出失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
