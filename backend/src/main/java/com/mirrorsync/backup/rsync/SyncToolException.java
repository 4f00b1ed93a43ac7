package com.mirrorsync.backup.rsync;

/**
 * The sync tool could not be started or its output could not be written.
 */
public class SyncToolException extends RuntimeException {
    public SyncToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
