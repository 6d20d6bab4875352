package com.autoping.monitor.ping.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
