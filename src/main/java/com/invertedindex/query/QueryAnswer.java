package com.invertedindex.query;

import java.util.List;

public record QueryAnswer(
        List<String> query,
        List<String> documents
) {
}
