package com.invertedindex.storage;

import com.invertedindex.index.InvertedIndex;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 倒排索引持久化策略。不同实现对应不同的文件布局，索引的公共契约保持不变。
 */
public interface StoragePolicy {

    /**
     * 将索引完整写入目标文件；失败时文件可能只写了一部分，由调用方负责清理。
     */
    void dump(InvertedIndex index, Path indexPath) throws IOException;

    /**
     * 从文件完整读取索引。
     */
    InvertedIndex load(Path indexPath) throws IOException;
}
