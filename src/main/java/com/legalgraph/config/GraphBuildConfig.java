package com.legalgraph.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Build, extraction and chain settings.
 * Corpus inputs and the storage root live in {@link CorpusDatasetConfig}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "citation-graph")
public class GraphBuildConfig {

    @NotBlank
    private String builderVersion = "2.0.0";

    @Valid
    private Build build = new Build();

    @Valid
    private Extraction extraction = new Extraction();

    @Valid
    private ChainSettings chain = new ChainSettings();

    /**
     * Extra corpus adapters declared in configuration.
     */
    @Valid
    private List<AdapterDefinition> adapters = new ArrayList<>();

    // ============================================================
    // Build Configuration
    // ============================================================
    @Data
    public static class Build {
        private boolean runOnStartup = false;

        @Min(1)
        private int batchSize = 2000;

        @Min(1)
        private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    // ============================================================
    // Extraction Configuration
    // ============================================================
    @Data
    public static class Extraction {
        /**
         * Maximum context snippet width in characters.
         */
        @Min(20)
        private int contextWidth = 100;

        /**
         * Characters before a match inspected for relationship cues.
         */
        @Min(0)
        private int cueLookbehind = 60;
    }

    // ============================================================
    // Chain Configuration
    // ============================================================
    @Data
    public static class ChainSettings {
        @Min(1)
        private int maxDepth = 5;

        @Min(1)
        private int maxNodes = 25;

        @Min(1)
        private int complexMinDepth = 3;

        @Min(2)
        private int complexMinSize = 4;
    }

    // ============================================================
    // Custom adapters
    // ============================================================
    @Data
    public static class AdapterDefinition {
        @NotBlank
        private String id;

        private String kind = "statute";

        private String headerPattern;

        private String headerNormalizer;

        private List<PatternDefinition> patterns = new ArrayList<>();
    }

    @Data
    public static class PatternDefinition {
        private String regex;

        private String relationship = "cites";

        private String normalizer = "verbatim";

        private boolean caseInsensitive = true;
    }
}
