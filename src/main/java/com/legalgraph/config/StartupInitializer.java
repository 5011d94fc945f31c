package com.legalgraph.config;

import com.legalgraph.dto.internal.BuildReport;
import com.legalgraph.service.corpus.CorpusAdapterRegistry;
import com.legalgraph.service.pipeline.CorpusBuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds all configured corpora at startup when
 * {@code citation-graph.build.run-on-startup} is set. A single corpus can be
 * selected with {@code --corpus=<id>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final GraphBuildConfig buildConfig;
    private final CorpusDatasetConfig datasetConfig;
    private final CorpusAdapterRegistry adapterRegistry;
    private final CorpusBuildService corpusBuildService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("CITATION GRAPH BUILDER {}", buildConfig.getBuilderVersion());
        log.info("adapters={} | corpora={} | storage_root={}",
                adapterRegistry.ids(), datasetConfig.getCorpora().size(), datasetConfig.getStorageRoot());
        log.info("{}\n", "=".repeat(70));

        if (!buildConfig.getBuild().isRunOnStartup()) {
            log.info("Startup build disabled (citation-graph.build.run-on-startup=false)");
            return;
        }

        try {
            List<String> selected = args.getOptionValues("corpus");
            if (selected != null && !selected.isEmpty()) {
                selected.forEach(corpusBuildService::build);
            } else {
                List<BuildReport> reports = corpusBuildService.buildAll();
                reports.forEach(r -> log.info("Built {} | documents={} | complex_chains={} | path={}",
                        r.getCorpusId(), r.getTotalDocuments(), r.getComplexChains(), r.getBuildPath()));
            }
        } catch (RuntimeException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("BUILD FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            throw e;
        }
    }
}
