package com.invertedindex.config;

import com.invertedindex.storage.StorageFormat;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 索引工具运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class IndexConfig {
    private Path datasetPath = Paths.get(Constants.DEFAULT_DATASET_PATH);
    private Path indexPath = Paths.get(Constants.DEFAULT_INDEX_PATH);
    private Charset documentCharset = Constants.DEFAULT_DOCUMENT_CHARSET;
    private Charset queryCharset = Constants.DEFAULT_QUERY_CHARSET;
    private StorageFormat storageFormat = StorageFormat.BINARY;

    public Path getDatasetPath() {
        return datasetPath;
    }

    public void setDatasetPath(Path datasetPath) {
        this.datasetPath = datasetPath;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public void setIndexPath(Path indexPath) {
        this.indexPath = indexPath;
    }

    public Charset getDocumentCharset() {
        return documentCharset;
    }

    public void setDocumentCharset(Charset documentCharset) {
        this.documentCharset = documentCharset;
    }

    public Charset getQueryCharset() {
        return queryCharset;
    }

    public void setQueryCharset(Charset queryCharset) {
        this.queryCharset = queryCharset;
    }

    public StorageFormat getStorageFormat() {
        return storageFormat;
    }

    public void setStorageFormat(StorageFormat storageFormat) {
        this.storageFormat = storageFormat;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }
}
