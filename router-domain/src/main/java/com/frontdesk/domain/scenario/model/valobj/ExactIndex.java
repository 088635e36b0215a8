package com.frontdesk.domain.scenario.model.valobj;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Set;

/**
 * 精确触发词索引：一个规范化触发词只对应一个场景（先注册者优先）。
 * <p>
 * 保持插入顺序，包含匹配按该顺序扫描。
 * </p>
 */
public final class ExactIndex {

    private static final ExactIndex EMPTY = new ExactIndex(ImmutableMap.of());

    private final ImmutableMap<String, RuntimeSpec> entries;

    public ExactIndex(ImmutableMap<String, RuntimeSpec> entries) {
        this.entries = entries == null ? ImmutableMap.of() : entries;
    }

    public static ExactIndex empty() {
        return EMPTY;
    }

    public RuntimeSpec get(String trigger) {
        return trigger == null ? null : entries.get(trigger);
    }

    public boolean containsKey(String trigger) {
        return trigger != null && entries.containsKey(trigger);
    }

    public Set<Map.Entry<String, RuntimeSpec>> entries() {
        return entries.entrySet();
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
