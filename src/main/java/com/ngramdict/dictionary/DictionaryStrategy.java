package com.ngramdict.dictionary;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 词典的两种等价内部表示。
 */
public enum DictionaryStrategy {

    /** 持有一份语料副本，词条与查询探针都是该内存上的视图 */
    POOLED {
        @Override
        public Dictionary build(byte[] corpus) {
            return new PooledDictionary(corpus);
        }
    },

    /** 每个词条独立持有一份字符串，查询时为每个候选窗口分配字符串 */
    COPYING {
        @Override
        public Dictionary build(byte[] corpus) {
            return new CopyingDictionary(corpus);
        }
    };

    /**
     * 复制语料并构建词典。调用返回后词典已完整可查询。
     */
    public abstract Dictionary build(byte[] corpus);

    /**
     * 按名称解析策略，大小写不敏感。
     *
     * @throws IllegalArgumentException 名称未知时抛出
     */
    public static DictionaryStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (DictionaryStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        String accepted = Arrays.stream(values())
            .map(strategy -> strategy.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("未知的词典策略: " + name + "（可选: " + accepted + "）");
    }
}
