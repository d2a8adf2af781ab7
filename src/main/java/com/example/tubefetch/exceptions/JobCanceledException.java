package com.example.tubefetch.exceptions;

/**
 * Unwinds a running job after the user asked to cancel it. Not a fault.
 */
public class JobCanceledException extends RuntimeException {
    public JobCanceledException(String jobId) {
        super("Job " + jobId + " was canceled");
    }
}
