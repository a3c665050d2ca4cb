package com.invertedindex.storage;

import com.invertedindex.config.Constants;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 词项编码方式及其标志位。
 *
 * <p>判定规则：所有码点都小于 256 时为窄编码（UTF-8 字节），否则为宽编码
 * （带小端 BOM 的 UTF-16）。128..255 区间的字符在 UTF-8 下是双字节，但仍判为窄编码；
 * 已持久化的文件依赖这条规则，修改需要格式版本升级。
 */
public enum TermEncoding {
    WIDE(Constants.WIDE_ENCODING_FLAG, StandardCharsets.UTF_16),
    NARROW(Constants.NARROW_ENCODING_FLAG, StandardCharsets.UTF_8);

    private static final byte[] LITTLE_ENDIAN_BOM = {(byte) 0xFF, (byte) 0xFE};

    private final int flag;
    private final Charset decodeCharset;

    TermEncoding(int flag, Charset decodeCharset) {
        this.flag = flag;
        this.decodeCharset = decodeCharset;
    }

    public int flag() {
        return flag;
    }

    /**
     * 按码点范围为词项选择编码。
     */
    public static TermEncoding classify(String term) {
        if (term == null) {
            throw new IllegalArgumentException("term 不能为null");
        }
        boolean narrow = term.codePoints().allMatch(codePoint -> codePoint < Constants.NARROW_CODE_POINT_LIMIT);
        return narrow ? NARROW : WIDE;
    }

    /**
     * 根据标志位解析编码方式。
     *
     * @throws IndexFormatException 标志位既不是 0 也不是 1 时抛出
     */
    public static TermEncoding fromFlag(int flag) throws IndexFormatException {
        for (TermEncoding encoding : values()) {
            if (encoding.flag == flag) {
                return encoding;
            }
        }
        throw new IndexFormatException("非法编码标志: " + flag);
    }

    /**
     * 将词项编码为字节。
     *
     * @throws IndexFormatException 词项含孤立代理项等无法编码的字符时抛出
     */
    public byte[] encode(String term) throws IndexFormatException {
        if (this == NARROW) {
            return strictEncode(StandardCharsets.UTF_8, term);
        }
        byte[] codeUnits = strictEncode(StandardCharsets.UTF_16LE, term);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(LITTLE_ENDIAN_BOM.length + codeUnits.length);
        buffer.writeBytes(LITTLE_ENDIAN_BOM);
        buffer.writeBytes(codeUnits);
        return buffer.toByteArray();
    }

    private byte[] strictEncode(Charset charset, String term) throws IndexFormatException {
        CharsetEncoder encoder = charset.newEncoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(term));
            byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        } catch (CharacterCodingException exception) {
            throw new IndexFormatException("词项无法按 " + name() + " 编码: " + exception.getMessage(), term);
        }
    }

    /**
     * 将字节解码为词项；宽编码按 BOM 识别字节序。
     *
     * @throws IndexFormatException 字节不是合法编码时抛出
     */
    public String decode(byte[] bytes) throws IndexFormatException {
        try {
            return decodeCharset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException exception) {
            throw new IndexFormatException("词项字节无法按 " + name() + " 编码解码, length=" + bytes.length, exception);
        }
    }
}
