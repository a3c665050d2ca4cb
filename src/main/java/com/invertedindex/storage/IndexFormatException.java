package com.invertedindex.storage;

import java.io.IOException;

/**
 * 索引文件格式错误：字段越界、非法 docId、非法编码标志或无法解码的词项。
 */
public class IndexFormatException extends IOException {
    private final String term;

    public IndexFormatException(String message) {
        this(message, (String) null);
    }

    public IndexFormatException(String message, String term) {
        super(term == null ? message : message + ", term=" + term);
        this.term = term;
    }

    public IndexFormatException(String message, Throwable cause) {
        super(message, cause);
        this.term = null;
    }

    /**
     * 出错的词项，未知时为 null。
     */
    public String getTerm() {
        return term;
    }
}
