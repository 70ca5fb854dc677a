package com.ngramdict.config;

import com.ngramdict.dictionary.DictionaryStrategy;

/**
 * 全局常量定义
 *
 * 包含分隔字节、n-gram窗口参数和命令行输入上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 分隔字节 ====================
    /** 语料词条分隔符 '\n' (0x0A) */
    public static final byte NEWLINE = '\n';
    /** 查询分词分隔符 ' ' (0x20)，不包含其他空白 */
    public static final byte SPACE = ' ';

    // ==================== 匹配参数 ====================
    /** 默认最大 n-gram 词数 */
    public static final int DEFAULT_MAX_NGRAM_SIZE = 3;
    /** 命令行允许的最大 n-gram 词数 */
    public static final int MAX_NGRAM_SIZE = 64;
    /** 默认词典表示 */
    public static final DictionaryStrategy DEFAULT_STRATEGY = DictionaryStrategy.POOLED;

    // ==================== 命令行参数 ====================
    /** 默认词典文件 */
    public static final String DEFAULT_DICTIONARY_FILE = "./dictionary.txt";
    /** 命令行查询最大字符数 */
    public static final int MAX_QUERY_LENGTH = 10_000;
}
