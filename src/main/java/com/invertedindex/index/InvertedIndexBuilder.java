package com.invertedindex.index;

import com.invertedindex.text.Tokenizer;
import com.invertedindex.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 倒排索引构建器，按文档迭代顺序把每个词项映射到出现过它的文档 ID。
 */
public class InvertedIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndexBuilder.class);

    private final Tokenizer tokenizer;

    public InvertedIndexBuilder() {
        this(new WhitespaceTokenizer());
    }

    public InvertedIndexBuilder(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("分词器不能为空");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 为文档集构建倒排索引。
     *
     * @param documents 文档 ID 到正文的映射
     * @return 不可变的倒排索引快照
     */
    public InvertedIndex build(Map<String, String> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("文档集不能为空");
        }
        logger.info("为 {} 篇文档构建倒排索引", documents.size());

        Map<String, Set<String>> postingsByTerm = new LinkedHashMap<>();
        for (Map.Entry<String, String> document : documents.entrySet()) {
            String docId = document.getKey();
            for (String term : tokenizer.tokenize(document.getValue())) {
                postingsByTerm.computeIfAbsent(term, key -> new LinkedHashSet<>()).add(docId);
            }
        }

        logger.debug("构建完成: {} 个词项", postingsByTerm.size());
        return new InvertedIndex(postingsByTerm);
    }
}
