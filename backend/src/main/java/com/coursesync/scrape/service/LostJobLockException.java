package com.coursesync.scrape.service;

public class LostJobLockException extends RuntimeException {
    public LostJobLockException(long jobId, String owner) {
        super("Job " + jobId + " is no longer locked by " + owner);
    }
}
