package com.legalgraph.config;

import com.legalgraph.service.storage.BuildWorkspace;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    public BuildWorkspace buildWorkspace(CorpusDatasetConfig datasetConfig) {
        return new BuildWorkspace(Paths.get(datasetConfig.getStorageRoot()).toAbsolutePath());
    }

    /**
     * Source of build timestamps and build ids.
     */
    @Bean
    public Clock buildClock() {
        return Clock.systemUTC();
    }
}
