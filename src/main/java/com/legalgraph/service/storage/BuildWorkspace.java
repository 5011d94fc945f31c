package com.legalgraph.service.storage;

import com.legalgraph.exception.GraphStoreException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * On-disk layout of the built stores:
 * <pre>
 * &lt;root&gt;/&lt;corpus&gt;/staging/          build in progress
 * &lt;root&gt;/&lt;corpus&gt;/builds/&lt;build-id&gt;/  completed builds
 * &lt;root&gt;/&lt;corpus&gt;/CURRENT            id of the build readers use
 * </pre>
 * Readers only follow {@code CURRENT}, so a staging build is never visible.
 */
@Slf4j
public class BuildWorkspace {

    public static final String STAGING = "staging";
    public static final String BUILDS = "builds";
    public static final String CURRENT = "CURRENT";

    @Getter
    private final Path root;

    public BuildWorkspace(Path root) {
        this.root = root;
    }

    public Path corpusDirectory(String corpusId) {
        return root.resolve(corpusId);
    }

    public Path stagingDirectory(String corpusId) {
        return corpusDirectory(corpusId).resolve(STAGING);
    }

    public Path buildDirectory(String corpusId, String buildId) {
        return corpusDirectory(corpusId).resolve(BUILDS).resolve(buildId);
    }

    /**
     * Directory of the build {@code CURRENT} points at, if any.
     */
    public Optional<Path> currentBuild(String corpusId) {
        Path pointer = corpusDirectory(corpusId).resolve(CURRENT);
        if (!Files.isRegularFile(pointer)) {
            return Optional.empty();
        }
        try {
            String buildId = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            if (buildId.isEmpty()) {
                return Optional.empty();
            }
            Path build = buildDirectory(corpusId, buildId);
            return Files.isDirectory(build) ? Optional.of(build) : Optional.empty();
        } catch (IOException e) {
            throw new GraphStoreException("Cannot read " + pointer, e);
        }
    }

    public String newBuildId(String corpusId, Clock clock) {
        String base = "build-" + clock.millis();
        String candidate = base;
        int suffix = 1;
        while (Files.exists(buildDirectory(corpusId, candidate))) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /**
     * Moves the finished staging directory under {@code builds/}, switches
     * {@code CURRENT} to it and removes every older build.
     */
    public Path promote(String corpusId, String buildId) {
        Path staging = stagingDirectory(corpusId);
        Path target = buildDirectory(corpusId, buildId);
        Path corpusDir = corpusDirectory(corpusId);
        try {
            Files.createDirectories(target.getParent());
            Files.move(staging, target);

            Path tmp = corpusDir.resolve(CURRENT + ".tmp");
            Files.writeString(tmp, buildId, StandardCharsets.UTF_8);
            moveReplacing(tmp, corpusDir.resolve(CURRENT));

            log.info("Promoted build | corpus={} | build={}", corpusId, buildId);
        } catch (IOException e) {
            throw new GraphStoreException("Cannot promote staging build of " + corpusId, e);
        }

        removeBuildsExcept(corpusId, buildId);
        return target;
    }

    public void wipeStaging(String corpusId) {
        Path staging = stagingDirectory(corpusId);
        if (Files.exists(staging)) {
            log.info("Removing stale staging directory | path={}", staging);
            deleteRecursively(staging);
        }
    }

    private void removeBuildsExcept(String corpusId, String keep) {
        Path builds = corpusDirectory(corpusId).resolve(BUILDS);
        List<Path> stale;
        try (Stream<Path> entries = Files.list(builds)) {
            stale = entries
                    .filter(p -> !p.getFileName().toString().equals(keep))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new GraphStoreException("Cannot list builds of " + corpusId, e);
        }
        for (Path old : stale) {
            log.debug("Removing superseded build | path={}", old);
            deleteRecursively(old);
        }
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported, falling back to replace | target={}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static void deleteRecursively(Path path) {
        try (Stream<Path> walk = Files.walk(path)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new GraphStoreException("Cannot delete " + path, e);
        }
    }
}
