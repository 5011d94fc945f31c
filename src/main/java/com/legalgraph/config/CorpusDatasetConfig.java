package com.legalgraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Corpus input files and the output root of the persisted stores.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "citation-graph.dataset")
public class CorpusDatasetConfig {

    /**
     * Directory holding one sub-directory per corpus.
     */
    @NotBlank
    private String storageRoot = "dist";

    @Valid
    private List<CorpusInput> corpora = new ArrayList<>();

    public Optional<CorpusInput> findCorpus(String corpusId) {
        return corpora.stream()
                .filter(c -> c.getId().equals(corpusId))
                .findFirst();
    }

    @Data
    public static class CorpusInput {

        /**
         * Adapter id, e.g. ohio_revised.
         */
        @NotBlank
        private String id;

        /**
         * JSONL (one document per line) or JSON array file.
         */
        @NotBlank
        private String input;
    }
}
