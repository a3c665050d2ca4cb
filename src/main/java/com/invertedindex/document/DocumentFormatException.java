package com.invertedindex.document;

import java.io.IOException;

/**
 * 文档集行格式错误，例如缺少 ID 与正文之间的制表符。
 */
public class DocumentFormatException extends IOException {
    private final int lineNumber;

    public DocumentFormatException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    /**
     * 出错行号，从 1 开始。
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
