package com.invertedindex.index;

import com.invertedindex.query.QueryEngine;
import com.invertedindex.storage.BinaryStoragePolicy;
import com.invertedindex.storage.StoragePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 倒排索引快照：词项到文档 ID 集合的映射。
 *
 * <p>构建完成后不可修改；词项按插入顺序迭代，保证相同构建得到相同的持久化字节。
 * 相等性只比较完整映射，与迭代顺序无关。
 */
public final class InvertedIndex {
    private static final Logger logger = LoggerFactory.getLogger(InvertedIndex.class);

    private final Map<String, Set<String>> postingsByTerm;

    /**
     * 以给定映射的迭代顺序复制出不可变快照。
     *
     * @param postingsByTerm 词项到文档 ID 集合的映射
     */
    public InvertedIndex(Map<String, ? extends Set<String>> postingsByTerm) {
        if (postingsByTerm == null) {
            throw new IllegalArgumentException("倒排映射不能为空");
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>(postingsByTerm.size() * 2);
        for (Map.Entry<String, ? extends Set<String>> entry : postingsByTerm.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("词项与文档集合均不能为null");
            }
            copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
        }
        this.postingsByTerm = Collections.unmodifiableMap(copy);
    }

    /**
     * 创建空索引。
     */
    public static InvertedIndex empty() {
        return new InvertedIndex(Map.of());
    }

    /**
     * 查找词项对应的文档 ID 集合。
     *
     * @param term 词项
     * @return 命中的集合或空
     */
    public Optional<Set<String>> postings(String term) {
        return Optional.ofNullable(postingsByTerm.get(term));
    }

    /**
     * 判断索引中是否包含指定词项。
     */
    public boolean contains(String term) {
        return postingsByTerm.containsKey(term);
    }

    /**
     * 返回全部词项（插入顺序）。
     */
    public Set<String> terms() {
        return postingsByTerm.keySet();
    }

    /**
     * 返回不可修改的完整映射视图。
     */
    public Map<String, Set<String>> asMap() {
        return postingsByTerm;
    }

    public int getTermCount() {
        return postingsByTerm.size();
    }

    /**
     * 对词项列表执行 AND 查询，结果顺序不作保证。
     *
     * @param terms 查询词项
     * @return 同时包含全部词项的文档 ID
     */
    public List<String> query(List<String> terms) {
        return new QueryEngine(this).query(terms);
    }

    /**
     * 使用默认二进制存储策略持久化索引。
     */
    public void dump(Path indexPath) throws IOException {
        dump(indexPath, new BinaryStoragePolicy());
    }

    public void dump(Path indexPath, StoragePolicy storagePolicy) throws IOException {
        logger.info("将 {} 个词项的倒排索引写入 {}", postingsByTerm.size(), indexPath);
        storagePolicy.dump(this, indexPath);
    }

    /**
     * 使用默认二进制存储策略加载索引。
     */
    public static InvertedIndex load(Path indexPath) throws IOException {
        return load(indexPath, new BinaryStoragePolicy());
    }

    public static InvertedIndex load(Path indexPath, StoragePolicy storagePolicy) throws IOException {
        logger.info("从 {} 加载倒排索引", indexPath);
        return storagePolicy.load(indexPath);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InvertedIndex that)) {
            return false;
        }
        return postingsByTerm.equals(that.postingsByTerm);
    }

    @Override
    public int hashCode() {
        return postingsByTerm.hashCode();
    }

    @Override
    public String toString() {
        return "InvertedIndex{terms=" + postingsByTerm.size() + "}";
    }
}
