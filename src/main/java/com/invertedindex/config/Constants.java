package com.invertedindex.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 全局常量定义
 *
 * 包含默认路径、二进制存储格式参数与编码参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 默认路径 ====================
    /** 默认文档集路径 */
    public static final String DEFAULT_DATASET_PATH = "small_wikipedia.sample";
    /** 默认倒排索引存储路径 */
    public static final String DEFAULT_INDEX_PATH = "inverted.index";

    // ==================== 存储格式参数 ====================
    /** 文件头 termCount 字段宽度（uint32） */
    public static final int HEADER_BYTES = Integer.BYTES;
    /** uint16 字段上限，docId、docCount 与词项字节长度共用 */
    public static final int MAX_UNSIGNED_SHORT = 0xFFFF;
    /** 窄编码（UTF-8）标志 */
    public static final int NARROW_ENCODING_FLAG = 1;
    /** 宽编码（UTF-16）标志 */
    public static final int WIDE_ENCODING_FLAG = 0;
    /** 窄编码判定阈值，所有码点严格小于该值时使用窄编码 */
    public static final int NARROW_CODE_POINT_LIMIT = 256;

    // ==================== 文本参数 ====================
    /** 文档集默认字符集 */
    public static final Charset DEFAULT_DOCUMENT_CHARSET = StandardCharsets.UTF_8;
    /** 查询文件默认字符集 */
    public static final Charset DEFAULT_QUERY_CHARSET = StandardCharsets.UTF_8;
    /** CP1251 查询文件字符集 */
    public static final Charset CP1251_CHARSET = Charset.forName("windows-1251");
    /** 文档 ID 与正文的分隔符 */
    public static final char DOCUMENT_ID_SEPARATOR = '\t';
    /** CLI 文本输出中答案文档 ID 的分隔符 */
    public static final String ANSWER_SEPARATOR = ",";
}
