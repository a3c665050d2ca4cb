package com.invertedindex.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.invertedindex.storage.StoragePolicy;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InvertedIndexTest {

    @TempDir
    Path tempDir;

    @Test
    void testEqualityIgnoresIterationOrder() {
        Map<String, Set<String>> first = new LinkedHashMap<>();
        first.put("a", Set.of("1"));
        first.put("b", Set.of("1", "2"));
        Map<String, Set<String>> second = new LinkedHashMap<>();
        second.put("b", Set.of("2", "1"));
        second.put("a", Set.of("1"));

        assertEquals(new InvertedIndex(first), new InvertedIndex(second));
        assertEquals(new InvertedIndex(first).hashCode(), new InvertedIndex(second).hashCode());
        assertNotEquals(new InvertedIndex(first), new InvertedIndex(Map.of("a", Set.of("1"))));
        assertNotEquals(new InvertedIndex(first), "not an index");
    }

    @Test
    void testSnapshotIsDetachedFromSourceMap() {
        Map<String, Set<String>> source = new HashMap<>();
        Set<String> postings = new HashSet<>(Set.of("1"));
        source.put("a", postings);

        InvertedIndex index = new InvertedIndex(source);
        postings.add("2");
        source.put("b", Set.of("3"));

        assertEquals(Set.of("1"), index.postings("a").orElseThrow());
        assertFalse(index.contains("b"));
    }

    @Test
    void testSnapshotIsUnmodifiable() {
        InvertedIndex index = new InvertedIndex(Map.of("a", Set.of("1")));

        assertThrows(UnsupportedOperationException.class, () -> index.asMap().put("b", Set.of()));
        assertThrows(UnsupportedOperationException.class, () -> index.postings("a").orElseThrow().add("2"));
        assertThrows(UnsupportedOperationException.class, () -> index.terms().remove("a"));
    }

    @Test
    void testLookup() {
        InvertedIndex index = new InvertedIndex(Map.of("a", Set.of("1"), "empty", Set.of()));

        assertTrue(index.contains("a"));
        assertTrue(index.contains("empty"));
        assertTrue(index.postings("empty").orElseThrow().isEmpty());
        assertTrue(index.postings("missing").isEmpty());
        assertEquals(2, index.getTermCount());
    }

    @Test
    void testQueryDelegatesToEngine() {
        InvertedIndex index = new InvertedIndex(Map.of("a", Set.of("1"), "b", Set.of("1", "2")));

        assertEquals(List.of("1"), index.query(List.of("a", "b")));
        assertTrue(index.query(List.of()).isEmpty());
    }

    @Test
    void testDumpAndLoadDelegateToPolicy() throws Exception {
        InvertedIndex index = new InvertedIndex(Map.of("a", Set.of("1")));
        Path target = tempDir.resolve("recorded.index");
        RecordingStoragePolicy policy = new RecordingStoragePolicy();

        index.dump(target, policy);
        InvertedIndex loaded = InvertedIndex.load(target, policy);

        assertSame(index, policy.dumped);
        assertEquals(target, policy.dumpedPath);
        assertEquals(target, policy.loadedPath);
        assertSame(index, loaded);
    }

    @Test
    void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> new InvertedIndex(null));
        Map<String, Set<String>> withNullPostings = new HashMap<>();
        withNullPostings.put("a", null);
        assertThrows(IllegalArgumentException.class, () -> new InvertedIndex(withNullPostings));
    }

    private static final class RecordingStoragePolicy implements StoragePolicy {
        private InvertedIndex dumped;
        private Path dumpedPath;
        private Path loadedPath;

        @Override
        public void dump(InvertedIndex index, Path indexPath) {
            this.dumped = index;
            this.dumpedPath = indexPath;
        }

        @Override
        public InvertedIndex load(Path indexPath) {
            this.loadedPath = indexPath;
            return dumped;
        }
    }
}
