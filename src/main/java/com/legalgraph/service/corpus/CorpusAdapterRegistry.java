package com.legalgraph.service.corpus;

import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.config.GraphBuildConfig.AdapterDefinition;
import com.legalgraph.config.GraphBuildConfig.PatternDefinition;
import com.legalgraph.dto.graph.RelationshipKind;
import com.legalgraph.exception.CorpusConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Holds every known corpus adapter: the Ohio built-ins plus any declared
 * under {@code citation-graph.adapters}. All patterns are compiled and
 * validated here, so a bad adapter fails the application before any
 * document is read.
 */
@Slf4j
@Component
public class CorpusAdapterRegistry {

    private final Map<String, CorpusAdapter> adapters = new LinkedHashMap<>();

    public CorpusAdapterRegistry(GraphBuildConfig config) {
        OhioCorpusAdapters.all().forEach(this::register);
        for (AdapterDefinition definition : config.getAdapters()) {
            register(fromDefinition(definition));
        }
        log.info("Loaded {} corpus adapters: {}", adapters.size(), adapters.keySet());
    }

    public CorpusAdapter get(String corpusId) {
        CorpusAdapter adapter = adapters.get(corpusId);
        if (adapter == null) {
            throw new CorpusConfigurationException("No corpus adapter registered for '" + corpusId + "'");
        }
        return adapter;
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    private void register(CorpusAdapter adapter) {
        if (adapter.getId() == null || adapter.getId().isBlank()) {
            throw new CorpusConfigurationException("Corpus adapter id must not be blank");
        }
        if (adapters.containsKey(adapter.getId())) {
            throw new CorpusConfigurationException("Duplicate corpus adapter id: " + adapter.getId());
        }
        adapters.put(adapter.getId(), adapter);
        log.debug("Registered {}", adapter);
    }

    static CorpusAdapter fromDefinition(AdapterDefinition definition) {
        String id = definition.getId();
        CorpusAdapter.CorpusAdapterBuilder builder = CorpusAdapter.builder()
                .id(id)
                .kind(CorpusKind.fromLabel(definition.getKind()));

        if (definition.getHeaderPattern() != null && !definition.getHeaderPattern().isBlank()) {
            String header = definition.getHeaderPattern();
            if (!header.contains("(?<" + CitationPattern.TARGET_GROUP + ">")) {
                throw new CorpusConfigurationException(
                        "Header pattern of adapter '" + id + "' has no named group 'target'");
            }
            try {
                builder.headerPattern(Pattern.compile(header, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new CorpusConfigurationException("Invalid header pattern for adapter '" + id + "'", e);
            }
            builder.headerNormalizer(definition.getHeaderNormalizer() == null
                    ? IdNormalizers.VERBATIM
                    : IdNormalizers.fromName(definition.getHeaderNormalizer()));
        }

        for (PatternDefinition pattern : definition.getPatterns()) {
            RelationshipKind relationship = parseRelationship(id, pattern.getRelationship());
            builder.pattern(CitationPattern.compile(
                    pattern.getRegex(),
                    relationship,
                    IdNormalizers.fromName(pattern.getNormalizer()),
                    pattern.isCaseInsensitive()));
        }
        return builder.build();
    }

    private static RelationshipKind parseRelationship(String adapterId, String label) {
        try {
            return RelationshipKind.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new CorpusConfigurationException(
                    "Adapter '" + adapterId + "' declares unknown relationship '" + label + "'", e);
        }
    }
}
