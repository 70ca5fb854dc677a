package com.ngramdict.dictionary;

import com.ngramdict.config.Constants;
import com.ngramdict.text.ByteSpan;
import com.ngramdict.text.ByteSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 复制式词典：每个词条是独立的字符串。
 *
 * <p>字符串按 ISO-8859-1 逐字节映射，一个字节对应一个 char，
 * 比较结果与逐字节比较完全一致，即使语料不是合法的 UTF-8。
 */
public final class CopyingDictionary implements Dictionary {
    private static final Logger logger = LoggerFactory.getLogger(CopyingDictionary.class);

    private final Set<String> entries;
    private final int corpusLength;

    public CopyingDictionary(byte[] corpus) {
        Objects.requireNonNull(corpus, "corpus");
        List<ByteSpan> tokens = ByteSplitter.split(corpus, Constants.NEWLINE);
        Set<String> owned = new HashSet<>(PooledDictionary.capacityFor(tokens.size()));
        for (ByteSpan token : tokens) {
            owned.add(token.toString(StandardCharsets.ISO_8859_1));
        }
        this.entries = owned;
        this.corpusLength = corpus.length;

        logger.debug("词典构建完成: strategy=COPYING, entries={}, corpusBytes={}", entries.size(), corpusLength);
    }

    @Override
    public boolean contains(byte[] bytes, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return entries.contains(new String(bytes, offset, length, StandardCharsets.ISO_8859_1));
    }

    @Override
    public boolean contains(ByteSpan span) {
        return entries.contains(span.toString(StandardCharsets.ISO_8859_1));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int corpusLength() {
        return corpusLength;
    }

    @Override
    public DictionaryStrategy strategy() {
        return DictionaryStrategy.COPYING;
    }
}
