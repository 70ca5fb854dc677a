package com.ngramdict;

import com.ngramdict.config.Constants;
import com.ngramdict.config.EngineConfig;
import com.ngramdict.dictionary.Dictionary;
import com.ngramdict.dictionary.DictionaryStrategy;
import com.ngramdict.match.NgramMatcher;
import com.ngramdict.text.ByteSpan;
import com.ngramdict.text.Utf8Codec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 对外入口：由语料构建词典，提供整体查询与 n-gram 匹配。
 *
 * <p>字节参数与文本参数在转换为 UTF-8 后行为完全一致；
 * 文本无法编码时按空输入处理。构造完成后实例只读，可被多个线程同时查询。
 */
public final class BufferSet {
    private static final Logger logger = LoggerFactory.getLogger(BufferSet.class);

    private final Dictionary dictionary;
    private final NgramMatcher matcher;

    public BufferSet(byte[] corpus) {
        this(corpus, Constants.DEFAULT_STRATEGY);
    }

    public BufferSet(String corpus) {
        this(Utf8Codec.encode(corpus), Constants.DEFAULT_STRATEGY);
    }

    public BufferSet(String corpus, DictionaryStrategy strategy) {
        this(Utf8Codec.encode(corpus), strategy);
    }

    public BufferSet(byte[] corpus, DictionaryStrategy strategy) {
        this.dictionary = strategy.build(corpus);
        this.matcher = new NgramMatcher(dictionary);
    }

    /**
     * 读取语料文件并按配置的策略构建。
     *
     * @throws IOException 文件无法读取时抛出
     */
    public static BufferSet load(Path corpusFile, EngineConfig config) throws IOException {
        byte[] corpus = Files.readAllBytes(corpusFile);
        logger.info("加载词典语料: {} ({} 字节)", corpusFile, corpus.length);
        return new BufferSet(corpus, config.getStrategy());
    }

    public boolean contains(byte[] needle) {
        return matcher.contains(needle);
    }

    public boolean contains(String needle) {
        return matcher.contains(Utf8Codec.encode(needle));
    }

    /**
     * 返回命中片段的字符串副本，顺序与匹配顺序一致。
     */
    public List<String> findAllMatches(byte[] haystack, int maxNgramSize) {
        return toStrings(matcher.findAllMatches(haystack, maxNgramSize));
    }

    public List<String> findAllMatches(String haystack, int maxNgramSize) {
        return toStrings(matcher.findAllMatches(Utf8Codec.encode(haystack), maxNgramSize));
    }

    public Dictionary dictionary() {
        return dictionary;
    }

    public int size() {
        return dictionary.size();
    }

    private static List<String> toStrings(List<ByteSpan> spans) {
        List<String> result = new ArrayList<>(spans.size());
        for (ByteSpan span : spans) {
            result.add(Utf8Codec.decode(span));
        }
        return result;
    }
}
