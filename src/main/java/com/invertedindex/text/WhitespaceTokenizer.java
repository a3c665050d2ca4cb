package com.invertedindex.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 按连续空白切分文本，词项原样保留：不做大小写归一、不去标点、不过滤停用词。
 */
public class WhitespaceTokenizer implements Tokenizer {

    /** NEL 不属于 Java 的空白字符类别，但同样作为行分隔 */
    private static final char NEXT_LINE = '\u0085';

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<String> terms = new ArrayList<>();
        int length = text.length();
        int offset = 0;
        while (offset < length) {
            while (offset < length && isSeparator(text.charAt(offset))) {
                offset++;
            }
            if (offset >= length) {
                break;
            }
            int start = offset;
            while (offset < length && !isSeparator(text.charAt(offset))) {
                offset++;
            }
            terms.add(text.substring(start, offset));
        }

        return List.copyOf(terms);
    }

    private static boolean isSeparator(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == NEXT_LINE;
    }
}
