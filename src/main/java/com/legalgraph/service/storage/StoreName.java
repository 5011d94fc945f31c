package com.legalgraph.service.storage;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The five key-value stores of a corpus build.
 */
public enum StoreName {

    PRIMARY("primary"),
    CITATIONS("citations"),
    REVERSE_CITATIONS("reverse_citations"),
    CHAINS("chains"),
    METADATA("metadata");

    public static final String CORPUS_INFO_KEY = "corpus_info";

    private final String storeName;

    StoreName(String storeName) {
        this.storeName = storeName;
    }

    public String getStoreName() {
        return storeName;
    }

    public String getTable() {
        return "kv_" + storeName;
    }

    public static List<String> names() {
        return Arrays.stream(values())
                .map(StoreName::getStoreName)
                .collect(Collectors.toList());
    }
}
