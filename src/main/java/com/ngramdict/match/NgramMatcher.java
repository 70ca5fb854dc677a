package com.ngramdict.match;

import com.ngramdict.config.Constants;
import com.ngramdict.dictionary.Dictionary;
import com.ngramdict.text.ByteSpan;
import com.ngramdict.text.ByteSplitter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 在查询文本上滑动最多 N 个空格分隔词的窗口，收集所有与词典词条完全相同的片段。
 *
 * <p>只读访问词典，多个线程可以共享同一个实例。
 */
public class NgramMatcher {

    private final Dictionary dictionary;

    public NgramMatcher(Dictionary dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
    }

    /**
     * 整体精确匹配，不分词。
     */
    public boolean contains(byte[] query) {
        return dictionary.contains(query, 0, query.length);
    }

    public List<ByteSpan> findAllMatches(byte[] query, int maxNgramSize) {
        return findAllMatches(query, 0, query.length, maxNgramSize);
    }

    /**
     * 查找 query[offset, offset + length) 中所有命中词典的 n-gram。
     *
     * <p>每遇到一个空格（以及查询末尾一次），按从旧到新的顺序测试窗口里的每个起点，
     * 即同一结束位置先测最长的片段。命中按测试顺序输出，不去重。
     * 结果是指向 query 的视图，调用方在使用结果期间不得修改 query。
     *
     * @param maxNgramSize 窗口最多包含的词数，按无符号32位整数解释，0 视为 1
     */
    public List<ByteSpan> findAllMatches(byte[] query, int offset, int length, int maxNgramSize) {
        Objects.checkFromIndexSize(offset, length, query.length);
        long window = effectiveWindow(maxNgramSize);
        int end = offset + length;

        List<ByteSpan> matches = new ArrayList<>();
        Deque<Integer> tokenStarts = new ArrayDeque<>();
        tokenStarts.addLast(offset);
        int cursor = offset;

        while (true) {
            int delimiter = ByteSplitter.indexOf(query, Constants.SPACE, cursor, end);
            if (delimiter < 0) {
                delimiter = end;
            }

            for (int tokenStart : tokenStarts) {
                if (dictionary.contains(query, tokenStart, delimiter - tokenStart)) {
                    matches.add(new ByteSpan(query, tokenStart, delimiter - tokenStart));
                }
            }

            if (tokenStarts.size() == window) {
                tokenStarts.removeFirst();
            }
            if (delimiter == end) {
                break;
            }

            cursor = delimiter + 1;
            tokenStarts.addLast(cursor);
        }

        return matches;
    }

    /**
     * 窗口大小：参数按无符号数读取，0 提升为 1。
     */
    public static long effectiveWindow(int maxNgramSize) {
        long window = Integer.toUnsignedLong(maxNgramSize);
        return window == 0 ? 1 : window;
    }
}
