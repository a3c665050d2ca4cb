package com.invertedindex.query;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * AND 查询的中间状态：尚未受任何词项约束，或已收敛到一组文档。
 *
 * <p>未知词项产生空的 {@link Matches}，之后的交集始终为空。
 */
public sealed interface Conjunction permits Conjunction.Unconstrained, Conjunction.Matches {

    /**
     * 与某个词项的文档集合求交。
     *
     * @param postings 词项命中的文档集合，未知词项传空集合
     * @return 新的中间状态
     */
    Conjunction and(Set<String> postings);

    /**
     * 转换为最终文档集合；未受约束时为空集合。
     */
    Set<String> documents();

    static Conjunction start() {
        return new Unconstrained();
    }

    record Unconstrained() implements Conjunction {
        @Override
        public Conjunction and(Set<String> postings) {
            return new Matches(new LinkedHashSet<>(postings));
        }

        @Override
        public Set<String> documents() {
            return Set.of();
        }
    }

    record Matches(Set<String> docIds) implements Conjunction {
        @Override
        public Conjunction and(Set<String> postings) {
            if (docIds.isEmpty()) {
                return this;
            }
            Set<String> retained = new LinkedHashSet<>(docIds);
            retained.retainAll(postings);
            return new Matches(retained);
        }

        @Override
        public Set<String> documents() {
            return docIds;
        }
    }
}
