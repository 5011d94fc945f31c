package com.legalgraph.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildReport {

    private String corpusId;

    private String buildId;

    private Path buildPath;

    private boolean resumed;

    private long documentsProcessed;

    private long documentsSkipped;

    private long totalDocuments;

    private long complexChains;

    private Double totalTime;

    @Builder.Default
    private Map<String, Double> stepDurations = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> stepDocuments = new LinkedHashMap<>();
}
