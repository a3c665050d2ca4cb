package com.invertedindex.query;

import com.invertedindex.document.DocumentLoader;
import com.invertedindex.index.InvertedIndex;
import com.invertedindex.index.InvertedIndexBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private final QueryEngine engine = new QueryEngine(abcIndex());

    @Test
    @DisplayName("单词项查询")
    void testSingleTerm() {
        assertEquals(Set.of("1", "2"), Set.copyOf(engine.query(List.of("b"))));
    }

    @Test
    @DisplayName("多词项 AND 查询")
    void testConjunction() {
        assertEquals(List.of("1"), engine.query(List.of("a", "b")));
        assertTrue(engine.query(List.of("a", "c")).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "nonexistent",
        "nonexistent b",
        "b nonexistent",
        "a nonexistent b",
        "b a nonexistent"
    })
    @DisplayName("任意位置出现未知词项时结果为空")
    void testUnknownTermAtAnyPosition(String query) {
        assertTrue(engine.query(Arrays.asList(query.split(" "))).isEmpty());
    }

    @Test
    @DisplayName("空查询返回空结果而不是全部文档")
    void testEmptyQuery() {
        assertTrue(engine.query(List.of()).isEmpty());
    }

    @Test
    @DisplayName("查询不会修改索引")
    void testQueryDoesNotMutateIndex() {
        InvertedIndex index = abcIndex();
        QueryEngine queryEngine = new QueryEngine(index);

        assertEquals(List.of("2"), queryEngine.query(List.of("b", "c")));
        assertEquals(Set.of("1", "2"), Set.copyOf(queryEngine.query(List.of("b"))));
        assertTrue(queryEngine.query(List.of("b", "missing")).isEmpty());
        assertEquals(Set.of("1", "2"), index.postings("b").orElseThrow());
        assertEquals(abcIndex(), index);
    }

    @Test
    @DisplayName("重复词项不影响结果")
    void testRepeatedTerms() {
        assertEquals(Set.of("1", "2"), Set.copyOf(engine.query(List.of("b", "b"))));
    }

    @Test
    @DisplayName("词项在加载后的空集合上求交")
    void testTermWithEmptyPostings() {
        QueryEngine queryEngine = new QueryEngine(new InvertedIndex(Map.of("hollow", Set.of(), "b", Set.of("1"))));

        assertTrue(queryEngine.query(List.of("hollow")).isEmpty());
        assertTrue(queryEngine.query(List.of("b", "hollow")).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "A_word,         123 37",
        "B_word,         2 37",
        "A_word B_word,  37",
        "some,           123 2",
        "to be,          5"
    })
    @DisplayName("tiny 文档集查询")
    void testTinyDataset(String query, String expected) throws Exception {
        Path dataset = Path.of(QueryEngineTest.class.getResource("/datasets/tiny_wikipedia.sample").toURI());
        InvertedIndex index = new InvertedIndexBuilder().build(new DocumentLoader().loadDocuments(dataset));

        List<String> answer = new QueryEngine(index).query(Arrays.asList(query.split(" ")));

        assertEquals(Set.of(expected.split(" ")), Set.copyOf(answer));
        assertEquals(answer.size(), Set.copyOf(answer).size());
    }

    @Test
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new QueryEngine(null));
        assertThrows(IllegalArgumentException.class, () -> engine.query(null));
    }

    private static InvertedIndex abcIndex() {
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("1", "a b");
        documents.put("2", "b c");
        return new InvertedIndexBuilder().build(documents);
    }
}
