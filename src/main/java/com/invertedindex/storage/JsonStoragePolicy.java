package com.invertedindex.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invertedindex.index.InvertedIndex;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * JSON 存储策略：{@code {"term": ["docId", ...]}}，保持词项迭代顺序，没有 uint16 限制。
 */
public class JsonStoragePolicy implements StoragePolicy {
    private static final TypeReference<LinkedHashMap<String, LinkedHashSet<String>>> POSTINGS_TYPE =
        new TypeReference<>() {
        };

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void dump(InvertedIndex index, Path indexPath) throws IOException {
        if (index == null) {
            throw new IllegalArgumentException("倒排索引不能为空");
        }
        try (OutputStream output = Files.newOutputStream(indexPath)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(output, index.asMap());
        }
    }

    @Override
    public InvertedIndex load(Path indexPath) throws IOException {
        Map<String, LinkedHashSet<String>> postingsByTerm;
        try (InputStream input = Files.newInputStream(indexPath)) {
            postingsByTerm = mapper.readValue(input, POSTINGS_TYPE);
        } catch (JsonProcessingException exception) {
            throw new IndexFormatException("JSON 索引文件格式错误: " + indexPath, exception);
        }
        if (postingsByTerm == null) {
            throw new IndexFormatException("JSON 索引文件内容为 null: " + indexPath);
        }
        for (Map.Entry<String, LinkedHashSet<String>> entry : postingsByTerm.entrySet()) {
            if (entry.getValue() == null || entry.getValue().contains(null)) {
                throw new IndexFormatException("JSON 索引文件包含 null 文档集合或文档ID", entry.getKey());
            }
        }
        return new InvertedIndex(postingsByTerm);
    }
}
