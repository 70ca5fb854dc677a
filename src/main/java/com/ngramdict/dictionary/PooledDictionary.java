package com.ngramdict.dictionary;

import com.ngramdict.config.Constants;
import com.ngramdict.text.ByteSpan;
import com.ngramdict.text.ByteSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 零拷贝词典：整份语料只复制一次，所有词条都是这块内存上的 {@link ByteSpan}。
 *
 * <p>查询时探针直接指向调用方的缓冲区，不会被放入词条集合。
 */
public final class PooledDictionary implements Dictionary {
    private static final Logger logger = LoggerFactory.getLogger(PooledDictionary.class);

    private final byte[] corpus;
    private final Set<ByteSpan> entries;

    /**
     * 复制语料并完成切分。
     */
    public PooledDictionary(byte[] corpus) {
        Objects.requireNonNull(corpus, "corpus");
        this.corpus = Arrays.copyOf(corpus, corpus.length);

        int expectedEntries = ByteSplitter.countOf(Constants.NEWLINE, this.corpus) + 1;
        Set<ByteSpan> tokens = new HashSet<>(capacityFor(expectedEntries));
        tokens.addAll(ByteSplitter.split(this.corpus, Constants.NEWLINE));
        this.entries = tokens;

        logger.debug("词典构建完成: strategy=POOLED, entries={}, corpusBytes={}", entries.size(), this.corpus.length);
    }

    @Override
    public boolean contains(byte[] bytes, int offset, int length) {
        return entries.contains(new ByteSpan(bytes, offset, length));
    }

    @Override
    public boolean contains(ByteSpan span) {
        return entries.contains(span);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int corpusLength() {
        return corpus.length;
    }

    @Override
    public DictionaryStrategy strategy() {
        return DictionaryStrategy.POOLED;
    }

    static int capacityFor(int expectedEntries) {
        return (int) Math.min(Integer.MAX_VALUE, (long) Math.ceil(expectedEntries / 0.75d) + 1);
    }
}
