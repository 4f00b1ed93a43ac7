package com.mirrorsync.backup.rsync;

import com.mirrorsync.backup.model.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

@Component
public class ProcessRsyncCommandRunner implements RsyncCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessRsyncCommandRunner.class);

    private final Executor outputExecutor;

    public ProcessRsyncCommandRunner(@Qualifier("rsyncOutputExecutor") Executor outputExecutor) {
        this.outputExecutor = outputExecutor;
    }

    @Override
    public CommandResult capture(List<String> command) {
        log.debug("Running {}", command);
        Process process = start(new ProcessBuilder(command), command);
        // stderr is drained on a separate thread so a full pipe cannot stall the tool
        CompletableFuture<String> stderr =
            CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), outputExecutor);
        String stdout;
        try {
            stdout = readFully(process.getInputStream());
        } catch (SyncToolException e) {
            process.destroy();
            throw e;
        }
        int exitCode = waitFor(process, command);
        try {
            return new CommandResult(exitCode, stdout, stderr.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncToolException("Interrupted while reading output of " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new SyncToolException("Failed to read stderr of " + command.get(0), e.getCause());
        }
    }

    @Override
    public int appendTo(List<String> command, Path logFile) {
        log.debug("Running {} > {}", command, logFile);
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = start(builder, command);
        return waitFor(process, command);
    }

    private Process start(ProcessBuilder builder, List<String> command) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new SyncToolException("Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    private int waitFor(Process process, List<String> command) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new SyncToolException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    private static String readFully(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SyncToolException("Failed to read tool output: " + e.getMessage(), e);
        }
    }
}
