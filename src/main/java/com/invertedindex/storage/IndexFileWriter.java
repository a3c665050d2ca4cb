package com.invertedindex.storage;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 二进制索引文件写入器。
 *
 * <p>布局（大端）：uint32 termCount，随后每个词项一条记录：
 * uint8 编码标志、uint16 词项字节长度、词项字节、uint16 文档数、每个文档一个 uint16 docId。
 * 关闭时校验实际写入的记录数与文件头声明一致。
 */
public final class IndexFileWriter implements AutoCloseable {
    private final DataOutputStream output;
    private final Path indexPath;
    private final int declaredTermCount;
    private int writtenTermCount;
    private boolean closed;

    /**
     * 创建写入器并写入文件头。
     *
     * @param indexPath 目标索引文件
     * @param termCount 将要写入的词项数
     * @throws IOException 打开或写入失败时抛出
     */
    public IndexFileWriter(Path indexPath, int termCount) throws IOException {
        if (indexPath == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        if (termCount < 0) {
            throw new IllegalArgumentException("termCount 不能为负数: " + termCount);
        }
        this.indexPath = indexPath;
        this.declaredTermCount = termCount;
        this.output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(indexPath)));
        try {
            output.writeInt(termCount);
        } catch (IOException exception) {
            output.close();
            throw exception;
        }
    }

    /**
     * 写入一条词项记录。整条记录先完成校验再写出。
     *
     * @param term 词项
     * @param docIds 文档 ID 集合，每个 ID 必须可解析为 [0, 65535] 内互不相同的整数
     * @throws IndexFormatException 字段越界、docId 非法或两个 docId 解析为同一整数时抛出
     * @throws IOException 写入失败时抛出
     */
    public void writeTermRecord(String term, Collection<String> docIds) throws IOException {
        ensureOpen();
        if (term == null || docIds == null) {
            throw new IllegalArgumentException("term 与 docIds 不能为null");
        }
        if (writtenTermCount >= declaredTermCount) {
            throw new IndexFormatException("写入词项数超过文件头声明: " + declaredTermCount, term);
        }

        TermEncoding encoding = TermEncoding.classify(term);
        byte[] termBytes = encoding.encode(term);
        StorageFileUtil.checkUnsignedShort(termBytes.length, "词项字节长度", term);
        StorageFileUtil.checkUnsignedShort(docIds.size(), "文档数", term);
        int[] numericDocIds = new int[docIds.size()];
        Map<Integer, String> seenDocIds = new HashMap<>();
        int index = 0;
        for (String docId : docIds) {
            int value = StorageFileUtil.parseDocId(docId, term);
            String previous = seenDocIds.putIfAbsent(value, docId);
            if (previous != null) {
                throw new IndexFormatException("文档ID重复: '" + previous + "' 与 '" + docId
                    + "' 均解析为 " + value, term);
            }
            numericDocIds[index++] = value;
        }

        output.writeByte(encoding.flag());
        output.writeShort(termBytes.length);
        output.write(termBytes);
        output.writeShort(numericDocIds.length);
        for (int docId : numericDocIds) {
            output.writeShort(docId);
        }
        writtenTermCount++;
    }

    public int getWrittenTermCount() {
        return writtenTermCount;
    }

    /**
     * 刷出缓冲并关闭文件，记录数与文件头不一致时抛出。
     *
     * @throws IOException 关闭失败或记录数不一致时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            output.flush();
            if (writtenTermCount != declaredTermCount) {
                throw new IndexFormatException("写入词项数与文件头不一致: file=" + indexPath
                    + ", declared=" + declaredTermCount + ", written=" + writtenTermCount);
            }
        } finally {
            output.close();
            closed = true;
        }
    }

    /**
     * 校验写入器状态，防止关闭后继续写入。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileWriter 已关闭");
        }
    }
}
