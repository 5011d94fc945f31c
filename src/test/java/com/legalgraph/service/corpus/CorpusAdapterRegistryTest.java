package com.legalgraph.service.corpus;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.config.GraphBuildConfig.AdapterDefinition;
import com.legalgraph.config.GraphBuildConfig.PatternDefinition;
import com.legalgraph.dto.graph.RelationshipKind;
import com.legalgraph.exception.CorpusConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusAdapterRegistryTest {

    @Test
    @DisplayName("should register the four built-in Ohio adapters")
    void shouldRegisterBuiltIns() {
        CorpusAdapterRegistry registry = new CorpusAdapterRegistry(new GraphBuildConfig());

        assertThat(registry.ids()).containsExactly(
                "ohio_revised", "ohio_administrative", "ohio_constitution", "ohio_case_law");
        assertThat(registry.get("ohio_case_law").getKind()).isEqualTo(CorpusKind.CASE_LAW);
        assertThat(registry.get("ohio_revised").getPatterns()).isNotEmpty();
    }

    @Test
    void shouldRejectUnknownCorpus() {
        CorpusAdapterRegistry registry = new CorpusAdapterRegistry(new GraphBuildConfig());

        assertThatThrownBy(() -> registry.get("ohio_municipal"))
                .isInstanceOf(CorpusConfigurationException.class)
                .hasMessageContaining("ohio_municipal");
    }

    @Test
    void shouldDeriveDocumentIdsFromHeaders() {
        CorpusAdapterRegistry registry = new CorpusAdapterRegistry(new GraphBuildConfig());

        assertThat(registry.get("ohio_revised").resolveDocumentId("Section 2913.02|Theft.")).hasValue("2913.02");
        assertThat(registry.get("ohio_administrative").resolveDocumentId("Rule 3701-17-01|Definitions."))
                .hasValue("3701-17-01");
        assertThat(registry.get("ohio_constitution").resolveDocumentId("Article I, Section 1|Inalienable Rights"))
                .hasValue("Article I, Section 1");
        assertThat(registry.get("ohio_revised").resolveDocumentId("Chapter 2913")).isEmpty();
    }

    @Nested
    @DisplayName("custom adapters from configuration")
    class CustomAdapters {

        @Test
        @DisplayName("should load a valid adapter")
        void shouldLoadValidAdapter() {
            GraphBuildConfig config = configWith(adapter("municipal",
                    pattern("\\bcode\\s+(?<target>\\d+\\.\\d+)", "cross_reference", "section_number")));

            CorpusAdapter adapter = new CorpusAdapterRegistry(config).get("municipal");

            assertThat(adapter.getKind()).isEqualTo(CorpusKind.STATUTE);
            assertThat(adapter.getPatterns()).hasSize(1);
            assertThat(adapter.getPatterns().get(0).getRelationship()).isEqualTo(RelationshipKind.CROSS_REFERENCE);
        }

        @Test
        @DisplayName("should accept an adapter without patterns")
        void shouldAcceptZeroPatterns() {
            GraphBuildConfig config = configWith(adapter("plain"));

            assertThat(new CorpusAdapterRegistry(config).get("plain").getPatterns()).isEmpty();
        }

        @Test
        @DisplayName("should reject a pattern without a target group")
        void shouldRejectMissingTargetGroup() {
            GraphBuildConfig config = configWith(adapter("broken",
                    pattern("\\bcode\\s+(\\d+\\.\\d+)", "cites", "verbatim")));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class)
                    .hasMessageContaining("target");
        }

        @Test
        @DisplayName("should reject a pattern that does not compile")
        void shouldRejectInvalidRegex() {
            GraphBuildConfig config = configWith(adapter("broken",
                    pattern("(?<target>[0-9", "cites", "verbatim")));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class);
        }

        @Test
        @DisplayName("should reject unknown as a declared relationship")
        void shouldRejectUnknownRelationship() {
            GraphBuildConfig config = configWith(adapter("broken",
                    pattern("(?<target>\\d+)", "unknown", "verbatim")));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class);
        }

        @Test
        void shouldRejectUndefinedRelationshipLabel() {
            GraphBuildConfig config = configWith(adapter("broken",
                    pattern("(?<target>\\d+)", "overrules", "verbatim")));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class)
                    .hasMessageContaining("overrules");
        }

        @Test
        void shouldRejectUndefinedNormalizer() {
            GraphBuildConfig config = configWith(adapter("broken",
                    pattern("(?<target>\\d+)", "cites", "phonetic")));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a duplicate adapter id")
        void shouldRejectDuplicateIds() {
            GraphBuildConfig config = configWith(adapter("ohio_revised"));

            assertThatThrownBy(() -> new CorpusAdapterRegistry(config))
                    .isInstanceOf(CorpusConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }
    }

    private static GraphBuildConfig configWith(AdapterDefinition... adapters) {
        GraphBuildConfig config = new GraphBuildConfig();
        config.setAdapters(List.of(adapters));
        return config;
    }

    private static AdapterDefinition adapter(String id, PatternDefinition... patterns) {
        AdapterDefinition definition = new AdapterDefinition();
        definition.setId(id);
        definition.setPatterns(List.of(patterns));
        return definition;
    }

    private static PatternDefinition pattern(String regex, String relationship, String normalizer) {
        PatternDefinition definition = new PatternDefinition();
        definition.setRegex(regex);
        definition.setRelationship(relationship);
        definition.setNormalizer(normalizer);
        return definition;
    }
}
