package com.mirrorsync.backup.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class JobAlreadyRunningException extends RuntimeException {
    public JobAlreadyRunningException(String jobId) {
        super("Job " + jobId + " is already running");
    }
}
