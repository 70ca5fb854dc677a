package com.ngramdict.text;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 字节区间视图：(底层数组, 起始偏移, 长度)，不复制内容。
 *
 * <p>相等性与哈希只取决于区间内的字节内容，与底层数组身份无关，
 * 因此语料缓冲区上的视图与查询缓冲区上的视图可以直接比较。
 * 视图持有底层数组的强引用，数组的生命周期不短于任何从它派生的视图。
 */
public final class ByteSpan {

    private final byte[] owner;
    private final int offset;
    private final int length;
    private final int hash;

    /**
     * 创建覆盖 owner[offset, offset + length) 的视图。
     *
     * @throws IndexOutOfBoundsException 区间越出数组边界时抛出
     */
    public ByteSpan(byte[] owner, int offset, int length) {
        Objects.requireNonNull(owner, "owner");
        Objects.checkFromIndexSize(offset, length, owner.length);
        this.owner = owner;
        this.offset = offset;
        this.length = length;
        this.hash = contentHash(owner, offset, length);
    }

    /**
     * 覆盖整个数组的视图。
     */
    public static ByteSpan of(byte[] owner) {
        return new ByteSpan(owner, 0, owner.length);
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    /**
     * 以 UTF-8 解码区间内容，返回独立的字符串副本。
     */
    public String toUtf8String() {
        return toString(StandardCharsets.UTF_8);
    }

    /**
     * 以指定字符集解码区间内容，直接读取底层数组，不经过中间副本。
     */
    public String toString(Charset charset) {
        return new String(owner, offset, length, charset);
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(owner, offset, offset + length);
    }

    /**
     * 判断区间内容是否与 other[otherOffset, otherOffset + otherLength) 逐字节相同。
     */
    public boolean contentEquals(byte[] other, int otherOffset, int otherLength) {
        return Arrays.equals(owner, offset, offset + length, other, otherOffset, otherOffset + otherLength);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ByteSpan span)) {
            return false;
        }
        return hash == span.hash && span.contentEquals(owner, offset, length);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return toUtf8String();
    }

    /**
     * 与 {@link Arrays#hashCode(byte[])} 相同的多项式哈希，仅作用于区间。
     */
    static int contentHash(byte[] bytes, int offset, int length) {
        int result = 1;
        for (int index = offset, end = offset + length; index < end; index++) {
            result = 31 * result + bytes[index];
        }
        return result;
    }
}
