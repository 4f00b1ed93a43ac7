package com.mirrorsync.backup.rsync;

import com.mirrorsync.backup.model.CommandResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Launches the external sync tool and blocks until it exits.
 */
public interface RsyncCommandRunner {

    /**
     * Runs the command and captures stdout and stderr separately.
     */
    CommandResult capture(List<String> command);

    /**
     * Runs the command, appending its combined stdout and stderr to {@code logFile}.
     *
     * @return the exit status
     */
    int appendTo(List<String> command, Path logFile);
}
