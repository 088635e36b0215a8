package com.frontdesk.domain.scenario.model.valobj;

import com.frontdesk.types.common.Constants;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import java.util.Set;

/**
 * 触发词/分词索引。
 * <p>
 * key 有两种：规范化触发词本身（允许重复追加），以及 {@code word:<token>}（每个桶内去重）。
 * 桶内保持插入顺序。
 * </p>
 */
public final class WordIndex {

    private static final WordIndex EMPTY = new WordIndex(ImmutableListMultimap.of());

    private final ImmutableListMultimap<String, RuntimeSpec> buckets;

    public WordIndex(ImmutableListMultimap<String, RuntimeSpec> buckets) {
        this.buckets = buckets == null ? ImmutableListMultimap.of() : buckets;
    }

    public static WordIndex empty() {
        return EMPTY;
    }

    public static String wordKey(String token) {
        return Constants.WORD_KEY_PREFIX + token;
    }

    public ImmutableList<RuntimeSpec> get(String key) {
        return key == null ? ImmutableList.of() : buckets.get(key);
    }

    public ImmutableList<RuntimeSpec> getByWord(String token) {
        return get(wordKey(token));
    }

    public boolean containsKey(String key) {
        return key != null && buckets.containsKey(key);
    }

    public Set<String> keys() {
        return buckets.keySet();
    }

    public int size() {
        return buckets.keySet().size();
    }
}
