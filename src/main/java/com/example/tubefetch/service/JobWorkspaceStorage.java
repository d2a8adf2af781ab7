package com.example.tubefetch.service;

import com.example.tubefetch.exceptions.WorkspaceStorageException;
import org.springframework.core.io.Resource;

import java.nio.file.Path;

/**
 * Per-job scratch directories under a single storage root. A job's directory is written only by
 * that job's runner.
 */
public interface JobWorkspaceStorage {

    Path createWorkspace(String jobId) throws WorkspaceStorageException;

    Path resolveWorkspace(String jobId) throws WorkspaceStorageException;

    /**
     * Removes the job's directory and everything in it. Missing directories are not an error.
     *
     * @return true if something was deleted.
     */
    boolean deleteWorkspace(String jobId) throws WorkspaceStorageException;

    /**
     * Opens a file for streaming. The file must live under the storage root.
     */
    Resource load(Path file) throws WorkspaceStorageException;

    /**
     * Deletes empty, stale directories left under the storage root.
     *
     * @return number of directories removed.
     */
    int sweepEmptyDirectories();
}
