package com.invertedindex;

import com.invertedindex.index.InvertedIndex;
import com.invertedindex.index.InvertedIndexBuilder;
import com.invertedindex.query.QueryEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 倒排索引性能基准测试：构建、二进制 dump/load 与 AND 查询
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class IndexState {
        Path tempDir;
        Path indexFile;
        Map<String, String> documents;
        InvertedIndex index;
        QueryEngine queryEngine;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            indexFile = tempDir.resolve("bench.index");

            // 生成10000篇文档，docId 落在 uint16 范围内
            documents = new LinkedHashMap<>();
            for (int i = 0; i < 10_000; i++) {
                documents.put(Integer.toString(i), generateDocument(i));
            }
            index = new InvertedIndexBuilder().build(documents);
            index.dump(indexFile);
            queryEngine = new QueryEngine(index);
        }

        @TearDown
        public void tearDown() throws IOException {
            try (Stream<Path> paths = Files.walk(tempDir)) {
                paths.sorted((a, b) -> -a.compareTo(b)).forEach(path -> {
                    try {
                        Files.deleteIfExists(path);
                    } catch (IOException exception) {
                        throw new UncheckedIOException(exception);
                    }
                });
            }
        }

        private String generateDocument(int index) {
            return "Document " + index + " about "
                + (index % 10 == 0 ? "Java programming"
                    : index % 10 == 1 ? "Python data science"
                    : index % 10 == 2 ? "машинное обучение"
                    : "general content")
                + " with various keywords for search testing."
                + " token" + (index % 97) + " bucket" + (index % 13);
        }
    }

    @Benchmark
    public InvertedIndex buildThroughput(IndexState state) {
        return new InvertedIndexBuilder().build(state.documents);
    }

    @Benchmark
    public void dumpThroughput(IndexState state) throws IOException {
        state.index.dump(state.tempDir.resolve("dump.index"));
    }

    @Benchmark
    public InvertedIndex loadThroughput(IndexState state) throws IOException {
        return InvertedIndex.load(state.indexFile);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public List<String> queryLatencySingleTerm(IndexState state) {
        return state.queryEngine.query(List.of("Java"));
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public List<String> queryLatencyConjunction(IndexState state) {
        return state.queryEngine.query(List.of("with", "token7", "bucket3"));
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
