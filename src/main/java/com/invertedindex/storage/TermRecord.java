package com.invertedindex.storage;

import java.util.Set;

/**
 * 索引文件中的一条词项记录。
 */
public record TermRecord(String term, Set<String> docIds) {
}
