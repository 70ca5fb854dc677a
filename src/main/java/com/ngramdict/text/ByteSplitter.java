package com.ngramdict.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 按单个分隔字节切分缓冲区，不做任何空白折叠或字符集处理。
 */
public final class ByteSplitter {

    private ByteSplitter() {
    }

    /**
     * 统计 buffer 中 target 字节出现的次数。
     */
    public static int countOf(byte target, byte[] buffer) {
        int count = 0;
        for (byte current : buffer) {
            if (current == target) {
                count++;
            }
        }
        return count;
    }

    /**
     * 从 fromIndex 开始查找 target，返回位置；在 toIndex 之前未找到时返回 -1。
     */
    public static int indexOf(byte[] buffer, byte target, int fromIndex, int toIndex) {
        for (int index = fromIndex; index < toIndex; index++) {
            if (buffer[index] == target) {
                return index;
            }
        }
        return -1;
    }

    /**
     * 按分隔字节切分出词条视图。
     *
     * <p>每个以分隔符结尾的片段都会输出，包括空片段；
     * 最后一个分隔符之后的片段只有非空时才输出，
     * 所以 {@code "a\nb\n"} 得到 [a, b]，{@code "a\n\nb"} 得到 [a, "", b]。
     */
    public static List<ByteSpan> split(byte[] buffer, byte delimiter) {
        List<ByteSpan> spans = new ArrayList<>(countOf(delimiter, buffer) + 1);
        int tokenStart = 0;

        for (int cursor = 0; cursor < buffer.length; cursor++) {
            if (buffer[cursor] == delimiter) {
                spans.add(new ByteSpan(buffer, tokenStart, cursor - tokenStart));
                tokenStart = cursor + 1;
            }
        }
        if (tokenStart < buffer.length) {
            spans.add(new ByteSpan(buffer, tokenStart, buffer.length - tokenStart));
        }

        return spans;
    }
}
