package com.mirrorsync.backup.rsync;

public class DetectionException extends RuntimeException {
    private final int exitCode;

    public DetectionException(int exitCode, String diagnostic) {
        super("rsync dry-run failed (rc=" + exitCode + ")" + (diagnostic == null || diagnostic.isBlank() ? "" : ": " + diagnostic));
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
