package com.ngramdict.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 文本参数与字节之间的转换。
 *
 * <p>无法编码的文本（例如孤立的代理字符）按空输入处理，不抛出异常，
 * 调用方因此无法区分“无匹配”与“输入无法解析”。
 */
public final class Utf8Codec {
    private static final Logger logger = LoggerFactory.getLogger(Utf8Codec.class);

    private static final byte[] EMPTY = new byte[0];

    private Utf8Codec() {
    }

    /**
     * 将文本编码为 UTF-8；null 或编码失败时返回空数组。
     */
    public static byte[] encode(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException exception) {
            logger.debug("文本无法编码为UTF-8，按空输入处理: {}", exception.toString());
            return EMPTY;
        }
    }

    /**
     * 以 UTF-8 解码视图内容，非法字节序列替换为 U+FFFD。
     */
    public static String decode(ByteSpan span) {
        return span.toUtf8String();
    }
}
