package com.invertedindex.storage;

import com.invertedindex.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 默认存储策略：定长字段的大端二进制布局，见 {@link IndexFileWriter}。
 *
 * <p>docId 与每个词项的文档数均受 uint16 限制，超出时 dump 失败而不是截断。
 */
public class BinaryStoragePolicy implements StoragePolicy {
    private static final Logger logger = LoggerFactory.getLogger(BinaryStoragePolicy.class);

    @Override
    public void dump(InvertedIndex index, Path indexPath) throws IOException {
        if (index == null) {
            throw new IllegalArgumentException("倒排索引不能为空");
        }
        try (IndexFileWriter writer = new IndexFileWriter(indexPath, index.getTermCount())) {
            for (Map.Entry<String, Set<String>> entry : index.asMap().entrySet()) {
                writer.writeTermRecord(entry.getKey(), entry.getValue());
            }
        }
        logger.debug("二进制索引写入完成: {}", indexPath);
    }

    @Override
    public InvertedIndex load(Path indexPath) throws IOException {
        Map<String, Set<String>> postingsByTerm = new LinkedHashMap<>();
        try (IndexFileReader reader = new IndexFileReader(indexPath)) {
            while (reader.hasNext()) {
                TermRecord record = reader.readTermRecord();
                postingsByTerm.put(record.term(), record.docIds());
            }
        }
        logger.debug("二进制索引读取完成: {} 个词项", postingsByTerm.size());
        return new InvertedIndex(postingsByTerm);
    }
}
