package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Per-run scratch directories. Directories outlive their run and are removed by the
 * scheduled cleaner once older than the configured retention.
 */
@Slf4j
@Component
public class RunWorkspaceManager {

    private final Path baseDir;
    private final Duration retention;

    public RunWorkspaceManager(RuntimeHubProperties properties) {
        this.baseDir = properties.getWorkspace().getBaseDir();
        this.retention = properties.getWorkspace().getRetention();
    }

    public Path create(String runId) {
        try {
            Files.createDirectories(baseDir);
            return Files.createTempDirectory(baseDir, sanitize(runId) + "-");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create workspace for run " + runId, e);
        }
    }

    @Scheduled(fixedDelayString = "${runtime-hub.workspace.cleanup-interval:PT1H}")
    public void cleanup() {
        int removed = removeOlderThan(Instant.now().minus(retention));
        if (removed > 0) {
            log.info("Removed {} expired run workspace(s) from {}", removed, baseDir);
        }
    }

    int removeOlderThan(Instant cutoff) {
        if (!Files.isDirectory(baseDir)) {
            return 0;
        }
        List<Path> expired;
        try (Stream<Path> dirs = Files.list(baseDir)) {
            expired = dirs.filter(Files::isDirectory)
                    .filter(dir -> lastModified(dir).isBefore(cutoff))
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list workspace directory {}: {}", baseDir, e.getMessage());
            return 0;
        }
        int removed = 0;
        for (Path dir : expired) {
            try {
                FileSystemUtils.deleteRecursively(dir);
                removed++;
            } catch (IOException e) {
                log.warn("Could not delete workspace {}: {}", dir, e.getMessage());
            }
        }
        return removed;
    }

    private static Instant lastModified(Path dir) {
        try {
            return Files.getLastModifiedTime(dir).toInstant();
        } catch (IOException e) {
            return Instant.now();
        }
    }

    private static String sanitize(String runId) {
        return runId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
