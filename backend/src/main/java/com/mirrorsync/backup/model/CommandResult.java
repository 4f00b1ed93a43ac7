package com.mirrorsync.backup.model;

public record CommandResult(
    int exitCode,
    String stdout,
    String stderr
) {

    public String diagnostic() {
        String err = stderr == null ? "" : stderr.trim();
        if (!err.isEmpty()) {
            return err;
        }
        return stdout == null ? "" : stdout.trim();
    }
}
