package com.invertedindex.storage;

import com.invertedindex.config.Constants;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;

/**
 * 存储文件工具方法，封装 uint16 范围校验、docId 解析与带上下文的定长读取。
 */
final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 校验数值可写入 uint16 字段。
     *
     * @param value 待写入的值
     * @param fieldName 字段名（用于错误消息）
     * @param term 所属词项
     * @throws IndexFormatException 越界时抛出
     */
    static void checkUnsignedShort(int value, String fieldName, String term) throws IndexFormatException {
        if (value < 0 || value > Constants.MAX_UNSIGNED_SHORT) {
            throw new IndexFormatException(fieldName + " 超出 uint16 范围: " + value, term);
        }
    }

    /**
     * 将文档 ID 字符串解析为 uint16。
     *
     * @param docId 文档 ID
     * @param term 所属词项
     * @return 解析后的整数
     * @throws IndexFormatException 非整数或越界时抛出
     */
    static int parseDocId(String docId, String term) throws IndexFormatException {
        int value;
        try {
            value = Integer.parseInt(docId);
        } catch (NumberFormatException exception) {
            throw new IndexFormatException("文档ID不是整数: '" + docId + "', term=" + term, exception);
        }
        checkUnsignedShort(value, "文档ID", term);
        return value;
    }

    /**
     * 读取 uint8，遇到 EOF 时附带字段上下文。
     */
    static int readUnsignedByte(DataInputStream input, String context) throws IOException {
        try {
            return input.readUnsignedByte();
        } catch (EOFException exception) {
            throw truncated(context, exception);
        }
    }

    /**
     * 读取大端 uint16，遇到 EOF 时附带字段上下文。
     */
    static int readUnsignedShort(DataInputStream input, String context) throws IOException {
        try {
            return input.readUnsignedShort();
        } catch (EOFException exception) {
            throw truncated(context, exception);
        }
    }

    /**
     * 读取大端 uint32，遇到 EOF 时附带字段上下文。
     */
    static long readUnsignedInt(DataInputStream input, String context) throws IOException {
        try {
            return Integer.toUnsignedLong(input.readInt());
        } catch (EOFException exception) {
            throw truncated(context, exception);
        }
    }

    /**
     * 读取定长字节块，剩余字节不足时抛出 EOF。
     */
    static byte[] readBytes(DataInputStream input, int length, String context) throws IOException {
        byte[] bytes = new byte[length];
        try {
            input.readFully(bytes);
        } catch (EOFException exception) {
            throw truncated(context + ", 声明长度=" + length, exception);
        }
        return bytes;
    }

    private static EOFException truncated(String context, EOFException cause) {
        EOFException exception = new EOFException("索引文件被截断，读取 " + context + " 时遇到 EOF");
        exception.initCause(cause);
        return exception;
    }
}
