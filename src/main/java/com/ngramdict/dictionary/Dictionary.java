package com.ngramdict.dictionary;

import com.ngramdict.text.ByteSpan;

/**
 * 以换行分隔语料构建的去重词典，构建完成后只读。
 */
public interface Dictionary {

    /**
     * 精确判断 bytes[offset, offset + length) 是否为词典词条。区分大小写，不做任何归一化。
     */
    boolean contains(byte[] bytes, int offset, int length);

    default boolean contains(byte[] bytes) {
        return contains(bytes, 0, bytes.length);
    }

    default boolean contains(ByteSpan span) {
        byte[] copy = span.toByteArray();
        return contains(copy, 0, copy.length);
    }

    /**
     * 去重后的词条数量。
     */
    int size();

    /**
     * 构建时语料的字节数。
     */
    int corpusLength();

    DictionaryStrategy strategy();
}
