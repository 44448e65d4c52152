package com.storefront.scraper.exception;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Job not found with id: " + jobId);
    }
}
