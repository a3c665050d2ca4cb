package com.invertedindex.query;

import com.invertedindex.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 对只读倒排索引执行词项 AND 查询。
 */
public class QueryEngine {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final InvertedIndex index;

    public QueryEngine(InvertedIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("倒排索引不能为空");
        }
        this.index = index;
    }

    /**
     * 返回同时包含全部词项的文档 ID，顺序不作保证。
     *
     * <p>空查询返回空结果；任意位置出现未知词项时结果为空。索引本身不会被修改。
     *
     * @param terms 查询词项
     * @return 命中文档 ID 列表
     */
    public List<String> query(List<String> terms) {
        if (terms == null) {
            throw new IllegalArgumentException("查询词项列表不能为null");
        }
        logger.debug("查询倒排索引: {}", terms);

        Conjunction conjunction = Conjunction.start();
        for (String term : terms) {
            Set<String> postings = index.postings(term).orElse(Set.of());
            conjunction = conjunction.and(postings);
        }
        return new ArrayList<>(conjunction.documents());
    }
}
