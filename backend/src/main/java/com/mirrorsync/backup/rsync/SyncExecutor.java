package com.mirrorsync.backup.rsync;

import com.mirrorsync.backup.model.RunOutcome;
import com.mirrorsync.config.MirrorSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Runs the real mirror and records the tool's raw output in a per-run log file.
 */
@Service
public class SyncExecutor {
    private static final Logger log = LoggerFactory.getLogger(SyncExecutor.class);
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final int MAX_NAME_ATTEMPTS = 1000;

    private final RsyncCommands commands;
    private final RsyncCommandRunner runner;
    private final Path logDir;
    private final ZoneId zone;
    private final Clock clock;

    public SyncExecutor(
        RsyncCommands commands,
        RsyncCommandRunner runner,
        MirrorSyncProperties properties,
        Clock clock
    ) {
        this.commands = commands;
        this.runner = runner;
        this.logDir = properties.getStorage().resolveLogDir();
        this.zone = properties.getScheduler().zoneId();
        this.clock = clock;
    }

    /**
     * A non-accepted exit status is returned as a failed outcome, not thrown.
     *
     * @throws SyncToolException if the target or log file cannot be created or rsync cannot be started
     */
    public RunOutcome execute(String source, String target, String jobId) {
        commands.ensureDirectory(target);
        ZonedDateTime startedAt = ZonedDateTime.now(clock.withZone(zone)).truncatedTo(ChronoUnit.SECONDS);
        Path logFile = createLogFile(jobId, startedAt);
        writeHeader(logFile, startedAt, source, target);

        int exitCode = runner.appendTo(commands.mirror(source, target), logFile);
        if (commands.isAccepted(exitCode)) {
            log.info("Mirror {} -> {} finished rc={} log={}", source, target, exitCode, logFile);
            return RunOutcome.success(logFile, exitCode);
        }
        log.warn("Mirror {} -> {} failed rc={} log={}", source, target, exitCode, logFile);
        return RunOutcome.failure(logFile, exitCode);
    }

    private Path createLogFile(String jobId, ZonedDateTime startedAt) {
        String baseName = jobId + "-" + LOG_STAMP.format(startedAt);
        try {
            Files.createDirectories(logDir);
            for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
                String name = attempt == 0 ? baseName + ".log" : baseName + "-" + attempt + ".log";
                try {
                    return Files.createFile(logDir.resolve(name));
                } catch (FileAlreadyExistsException e) {
                    log.debug("Log file {} already exists, trying next suffix", name);
                }
            }
        } catch (IOException e) {
            throw new SyncToolException("Failed to create log file in " + logDir + ": " + e.getMessage(), e);
        }
        throw new SyncToolException("No free log file name for " + baseName + " in " + logDir, null);
    }

    private void writeHeader(Path logFile, ZonedDateTime startedAt, String source, String target) {
        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8, StandardOpenOption.APPEND)) {
            writer.write("# " + DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(startedAt) + " rsync " + source + " -> " + target);
            writer.newLine();
            writer.newLine();
        } catch (IOException e) {
            throw new SyncToolException("Failed to write log header to " + logFile + ": " + e.getMessage(), e);
        }
    }
}
