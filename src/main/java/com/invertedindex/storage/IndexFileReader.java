package com.invertedindex.storage;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 二进制索引文件读取器，按文件头声明的数量顺序读出词项记录。
 *
 * <p>格式没有魔数与校验和，结构损坏只能通过截断被发现；最后一条记录之后的字节被忽略。
 */
public final class IndexFileReader implements AutoCloseable {
    private final DataInputStream input;
    private final Path indexPath;
    private final long termCount;
    private long readTermCount;

    /**
     * 打开索引文件并读取文件头。
     *
     * @param indexPath 索引文件
     * @throws java.nio.file.NoSuchFileException 文件不存在时抛出
     * @throws java.io.EOFException 文件不足 4 字节时抛出
     * @throws IOException 读取失败时抛出
     */
    public IndexFileReader(Path indexPath) throws IOException {
        if (indexPath == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        this.indexPath = indexPath;
        this.input = new DataInputStream(new BufferedInputStream(Files.newInputStream(indexPath)));
        try {
            this.termCount = StorageFileUtil.readUnsignedInt(input, "文件头 termCount, file=" + indexPath);
        } catch (IOException exception) {
            input.close();
            throw exception;
        }
    }

    /**
     * 文件头声明的词项数。
     */
    public long getTermCount() {
        return termCount;
    }

    /**
     * 是否还有未读取的记录。
     */
    public boolean hasNext() {
        return readTermCount < termCount;
    }

    /**
     * 读取下一条词项记录。
     *
     * @return 词项与其文档 ID 集合；docId 以十进制字符串还原
     * @throws java.io.EOFException 文件被截断时抛出
     * @throws IndexFormatException 编码标志非法或词项无法解码时抛出
     */
    public TermRecord readTermRecord() throws IOException {
        if (!hasNext()) {
            throw new IllegalStateException("已读取全部 " + termCount + " 条记录: " + indexPath);
        }
        String context = "记录#" + readTermCount + ", file=" + indexPath;

        TermEncoding encoding = TermEncoding.fromFlag(StorageFileUtil.readUnsignedByte(input, "编码标志 " + context));
        int termLength = StorageFileUtil.readUnsignedShort(input, "词项长度 " + context);
        byte[] termBytes = StorageFileUtil.readBytes(input, termLength, "词项字节 " + context);
        String term = encoding.decode(termBytes);

        int docCount = StorageFileUtil.readUnsignedShort(input, "文档数 " + context);
        Set<String> docIds = new LinkedHashSet<>(Math.max(16, docCount * 2));
        for (int docIndex = 0; docIndex < docCount; docIndex++) {
            docIds.add(Integer.toString(StorageFileUtil.readUnsignedShort(input, "文档ID " + context)));
        }

        readTermCount++;
        return new TermRecord(term, docIds);
    }

    @Override
    public void close() throws IOException {
        input.close();
    }
}
