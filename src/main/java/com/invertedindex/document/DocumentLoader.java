package com.invertedindex.document;

import com.invertedindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 文档集加载器，读取 {@code <id>\t<text>} 格式的行式文本文件。
 *
 * <p>ID 为首个制表符之前的全部内容，正文为其后的内容并去除行尾空白。
 * 重复 ID 时后出现的行覆盖先前的映射。
 */
public final class DocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentLoader.class);

    private final Charset charset;

    /**
     * 使用默认 UTF-8 字符集构造加载器。
     */
    public DocumentLoader() {
        this(Constants.DEFAULT_DOCUMENT_CHARSET);
    }

    public DocumentLoader(Charset charset) {
        if (charset == null) {
            throw new IllegalArgumentException("字符集不能为空");
        }
        this.charset = charset;
    }

    /**
     * 加载文档集，返回按首次出现顺序排列的 ID 到正文映射。
     *
     * @param datasetPath 文档集路径
     * @return 文档 ID 到正文的映射
     * @throws java.nio.file.NoSuchFileException 文件不存在时抛出
     * @throws DocumentFormatException 行缺少制表符时抛出
     * @throws IOException 读取失败时抛出
     */
    public Map<String, String> loadDocuments(Path datasetPath) throws IOException {
        if (datasetPath == null) {
            throw new IllegalArgumentException("文档集路径不能为空");
        }
        Map<String, String> documents = new LinkedHashMap<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(datasetPath, charset)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                int separatorIndex = line.indexOf(Constants.DOCUMENT_ID_SEPARATOR);
                if (separatorIndex < 0) {
                    throw new DocumentFormatException("文档行缺少制表符分隔符: " + datasetPath, lineNumber);
                }
                String docId = line.substring(0, separatorIndex);
                String text = line.substring(separatorIndex + 1).stripTrailing();
                documents.put(docId, text);
            }
        }
        logger.debug("从 {} 读取 {} 行，得到 {} 篇文档", datasetPath, lineNumber, documents.size());
        return documents;
    }
}
