package com.invertedindex.text;

import java.util.List;

/**
 * 把文档正文或查询行切分为词项。只产出词项文本，索引不保留位置信息。
 */
@FunctionalInterface
public interface Tokenizer {

    /**
     * @param text 待切分文本，null 视为空文本
     * @return 按出现顺序排列的词项，可能含重复
     */
    List<String> tokenize(String text);
}
