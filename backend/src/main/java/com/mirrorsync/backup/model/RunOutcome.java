package com.mirrorsync.backup.model;

import java.nio.file.Path;

/**
 * Result of a real mirror run. {@code exitCode} is the raw rsync status.
 */
public record RunOutcome(
    boolean ok,
    Path logFile,
    int exitCode
) {

    public static RunOutcome success(Path logFile, int exitCode) {
        return new RunOutcome(true, logFile, exitCode);
    }

    public static RunOutcome failure(Path logFile, int exitCode) {
        return new RunOutcome(false, logFile, exitCode);
    }

    public String summary() {
        if (ok) {
            return "OK - log: " + logFile;
        }
        return "ERROR (rc=" + exitCode + ") - details: " + logFile;
    }
}
