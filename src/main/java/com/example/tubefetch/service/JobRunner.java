package com.example.tubefetch.service;

import com.example.tubefetch.domain.DownloadJob;

/**
 * Executes one job from dispatch to a terminal state. Never throws: every outcome is recorded on the job.
 */
public interface JobRunner {

    void run(DownloadJob job);
}
