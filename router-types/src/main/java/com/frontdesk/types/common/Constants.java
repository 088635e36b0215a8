package com.frontdesk.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义场景编译、候选检索与 Truth Bundle 导出共用的常量。
 * </p>
 *
 * @author frontdesk
 * @since 2026-03-02
 */
public class Constants {

    /** 逗号分隔符，用于字符串分割操作 */
    public final static String SPLIT = ",";

    /** 词索引 key 前缀 */
    public final static String WORD_KEY_PREFIX = "word:";

    /** 名称占位符 */
    public final static String NAME_PLACEHOLDER = "{name}";

    /** Truth Bundle schema 标识 */
    public final static String TRUTH_BUNDLE_SCHEMA = "TRUTH_BUNDLE_V1";

    /** 未命中场景时 trace 使用的哨兵 id */
    public final static String FALLBACK_SCENARIO_ID = "fallback";

    /** 越界路径告警类型 */
    public final static String OUT_OF_TREE_PATH = "OUT_OF_TREE_PATH";

}
