package com.invertedindex.storage;

import com.invertedindex.document.DocumentLoader;
import com.invertedindex.index.InvertedIndex;
import com.invertedindex.index.InvertedIndexBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * 存储层 round-trip 测试：dump 后 load 得到相等的索引，且相同构建写出相同字节。
 */
class StorageRoundTripTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @ValueSource(strings = {"tiny_wikipedia.sample", "small_wikipedia.sample"})
    void datasetRoundTrip(String datasetName) throws Exception {
        InvertedIndex index = buildFromDataset(datasetName);
        Path indexFile = tempDir.resolve(datasetName + ".index");

        index.dump(indexFile);
        InvertedIndex loaded = InvertedIndex.load(indexFile);

        assertEquals(index, loaded);
        assertEquals(List.copyOf(index.terms()), List.copyOf(loaded.terms()));
    }

    @ParameterizedTest
    @EnumSource(StorageFormat.class)
    void roundTripWithEveryPolicy(StorageFormat format) throws Exception {
        InvertedIndex index = buildFromDataset("small_wikipedia.sample");
        Path indexFile = tempDir.resolve("small." + format.name().toLowerCase());

        index.dump(indexFile, format.createPolicy());

        assertEquals(index, InvertedIndex.load(indexFile, format.createPolicy()));
    }

    @Test
    void mixedScriptRoundTrip() throws IOException {
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("1", "plain café Zürich ÿ");
        documents.put("2", "Москва café 東京 😀");
        documents.put("65535", "Ā ā plain");
        InvertedIndex index = new InvertedIndexBuilder().build(documents);
        Path indexFile = tempDir.resolve("mixed.index");

        index.dump(indexFile);

        assertEquals(index, InvertedIndex.load(indexFile));
    }

    @Test
    void randomIndexRoundTrip() throws IOException {
        Random random = new Random(7);
        String[] vocabulary = {"alpha", "beta", "gamma", "δέλτα", "эпсилон", "zeta", "ηта", "θ", "ι", "κάππα"};
        Map<String, String> documents = new LinkedHashMap<>();
        for (int document = 0; document < 500; document++) {
            StringBuilder text = new StringBuilder();
            for (int word = 0; word < 8; word++) {
                text.append(vocabulary[random.nextInt(vocabulary.length)]).append(' ');
            }
            documents.put(Integer.toString(random.nextInt(65536)), text.toString());
        }
        InvertedIndex index = new InvertedIndexBuilder().build(documents);
        Path indexFile = tempDir.resolve("random.index");

        index.dump(indexFile);

        assertEquals(index, InvertedIndex.load(indexFile));
    }

    @Test
    void identicalBuildsProduceIdenticalBytes() throws Exception {
        Path first = tempDir.resolve("first.index");
        Path second = tempDir.resolve("second.index");

        buildFromDataset("small_wikipedia.sample").dump(first);
        buildFromDataset("small_wikipedia.sample").dump(second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    void reloadedIndexDumpsSameBytes() throws Exception {
        Path first = tempDir.resolve("first.index");
        Path second = tempDir.resolve("second.index");

        buildFromDataset("tiny_wikipedia.sample").dump(first);
        InvertedIndex.load(first).dump(second);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    private static InvertedIndex buildFromDataset(String datasetName) throws Exception {
        Path dataset = Path.of(StorageRoundTripTest.class.getResource("/datasets/" + datasetName).toURI());
        return new InvertedIndexBuilder().build(new DocumentLoader().loadDocuments(dataset));
    }
}
