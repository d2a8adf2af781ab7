package com.example.tubefetch.service.impl;

import com.example.tubefetch.exceptions.WorkspaceStorageException;
import com.example.tubefetch.service.JobWorkspaceStorage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Service
public class FilesystemJobWorkspaceStorage implements JobWorkspaceStorage {

    private static final Logger log = LoggerFactory.getLogger(FilesystemJobWorkspaceStorage.class);

    private final Path rootLocation;
    private final Clock clock;
    private final Duration emptyDirectoryMinAge;

    public FilesystemJobWorkspaceStorage(
            @Value("${download.storage.path}") String path,
            @Value("${storage.empty-dir-min-age-minutes:10}") long emptyDirectoryMinAgeMinutes,
            Clock clock) {
        this.rootLocation = Paths.get(path).toAbsolutePath().normalize();
        this.emptyDirectoryMinAge = Duration.ofMinutes(emptyDirectoryMinAgeMinutes);
        this.clock = clock;
    }

    @PostConstruct
    private void initialize() {
        try {
            Files.createDirectories(rootLocation);
            log.info("Download storage directory initialized at: {}", this.rootLocation);
        } catch (IOException e) {
            throw new WorkspaceStorageException("Could not initialize storage directory: " + this.rootLocation, e);
        }
    }

    @Override
    public Path createWorkspace(String jobId) throws WorkspaceStorageException {
        Path workspace = resolveWorkspace(jobId);
        try {
            Files.createDirectories(workspace);
            log.debug("[Job:{}] Workspace created at {}", jobId, workspace);
            return workspace;
        } catch (IOException e) {
            throw new WorkspaceStorageException("Could not create workspace for job " + jobId, e);
        }
    }

    @Override
    public Path resolveWorkspace(String jobId) throws WorkspaceStorageException {
        if (jobId == null || jobId.isBlank()
                || jobId.contains("/") || jobId.contains("\\") || jobId.contains("..")) {
            throw new WorkspaceStorageException("Invalid job id for workspace: " + jobId);
        }
        try {
            Path workspace = rootLocation.resolve(jobId).normalize().toAbsolutePath();
            // The workspace must be a direct child of the root
            if (!rootLocation.equals(workspace.getParent())) {
                log.error("SECURITY ALERT: Workspace resolved outside the storage root for job {}", jobId);
                throw new WorkspaceStorageException("Security check failed: workspace outside storage root.");
            }
            return workspace;
        } catch (InvalidPathException e) {
            throw new WorkspaceStorageException("Invalid job id for workspace: " + jobId, e);
        }
    }

    @Override
    public boolean deleteWorkspace(String jobId) throws WorkspaceStorageException {
        Path workspace = resolveWorkspace(jobId);
        if (!Files.exists(workspace)) {
            log.debug("[Job:{}] Workspace already gone: {}", jobId, workspace);
            return false;
        }
        try {
            deleteRecursively(workspace);
            log.info("[Job:{}] Workspace deleted", jobId);
            return true;
        } catch (IOException | UncheckedIOException e) {
            throw new WorkspaceStorageException("Failed to delete workspace for job " + jobId, e);
        }
    }

    @Override
    public Resource load(Path file) throws WorkspaceStorageException {
        try {
            Path validated = validateInsideRoot(file);
            log.debug("Attempting to load resource from path: {}", validated);

            Resource resource = new UrlResource(validated.toUri());
            if (resource.exists() && resource.isReadable()) {
                return resource;
            }
            String reason = resource.exists() ? "not readable" : "does not exist";
            log.warn("Could not read file or file does not exist: {} ({})", validated, reason);
            throw new WorkspaceStorageException("Could not read file: " + validated.getFileName() + " (File " + reason + ")");
        } catch (MalformedURLException e) {
            throw new WorkspaceStorageException("Could not read file (Malformed URL): " + file, e);
        }
    }

    @Override
    @Scheduled(fixedDelayString = "${storage.sweep-interval-ms:300000}",
            initialDelayString = "${storage.sweep-interval-ms:300000}")
    public int sweepEmptyDirectories() {
        Instant threshold = clock.instant().minus(emptyDirectoryMinAge);
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(rootLocation)) {
            candidates = walk
                    .filter(Files::isDirectory)
                    .filter(dir -> !dir.equals(rootLocation))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not scan storage root {} for empty directories: {}", rootLocation, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path dir : candidates) {
            try {
                if (isEmpty(dir) && Files.getLastModifiedTime(dir).toInstant().isBefore(threshold)) {
                    Files.delete(dir);
                    removed++;
                    log.debug("Removed empty directory {}", dir);
                }
            } catch (IOException e) {
                // A job may have just written into it; the next sweep will look again
                log.debug("Skipped directory {} during sweep: {}", dir, e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Storage sweep removed {} empty directories", removed);
        }
        return removed;
    }

    //    Helper methods

    private Path validateInsideRoot(Path file) throws WorkspaceStorageException {
        if (file == null) {
            throw new WorkspaceStorageException("File path cannot be null.");
        }
        Path normalized = file.toAbsolutePath().normalize();
        if (!normalized.startsWith(rootLocation)) {
            throw new WorkspaceStorageException("Security check failed: Cannot access file outside designated directory.");
        }
        return normalized;
    }

    private boolean isEmpty(Path dir) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        }
    }

    private void deleteRecursively(Path target) throws IOException {
        try (Stream<Path> walk = Files.walk(target)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
        }
    }
}
