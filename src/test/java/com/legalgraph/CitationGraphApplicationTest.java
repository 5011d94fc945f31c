package com.legalgraph;

import com.legalgraph.config.CorpusDatasetConfig;
import com.legalgraph.config.GraphBuildConfig;
import com.legalgraph.service.corpus.CorpusAdapterRegistry;
import com.legalgraph.service.pipeline.CorpusBuildService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "citation-graph.dataset.storage-root=target/test-dist")
class CitationGraphApplicationTest {

    @Autowired
    private GraphBuildConfig buildConfig;

    @Autowired
    private CorpusDatasetConfig datasetConfig;

    @Autowired
    private CorpusAdapterRegistry adapterRegistry;

    @Autowired
    private CorpusBuildService corpusBuildService;

    @Test
    void shouldBindDefaultsAndRegisterBuiltInAdapters() {
        assertThat(corpusBuildService).isNotNull();
        assertThat(buildConfig.getBuild().isRunOnStartup()).isFalse();
        assertThat(buildConfig.getExtraction().getContextWidth()).isEqualTo(100);
        assertThat(buildConfig.getChain().getMaxDepth()).isEqualTo(5);
        assertThat(buildConfig.getChain().getMaxNodes()).isEqualTo(25);
        assertThat(datasetConfig.getCorpora()).hasSize(4);
        assertThat(datasetConfig.getStorageRoot()).isEqualTo("target/test-dist");
        assertThat(adapterRegistry.ids())
                .containsExactly("ohio_revised", "ohio_administrative", "ohio_constitution", "ohio_case_law");
    }
}
