package com.legalgraph.dto.internal;

import java.util.List;

public record ChainResult(String rootId, List<String> sections, int depth) {

    public int size() {
        return sections.size();
    }
}
