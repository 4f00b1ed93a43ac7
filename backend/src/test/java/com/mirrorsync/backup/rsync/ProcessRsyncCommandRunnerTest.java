package com.mirrorsync.backup.rsync;

import com.mirrorsync.backup.model.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProcessRsyncCommandRunnerTest {

    @TempDir
    Path tmp;

    private final AtomicInteger drainedOnOutputExecutor = new AtomicInteger();
    private ExecutorService outputPool;
    private ProcessRsyncCommandRunner runner;

    @BeforeEach
    void setUp() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");
        outputPool = Executors.newSingleThreadExecutor();
        runner = new ProcessRsyncCommandRunner(task -> {
            drainedOnOutputExecutor.incrementAndGet();
            outputPool.execute(task);
        });
    }

    @AfterEach
    void tearDown() {
        if (outputPool != null) {
            outputPool.shutdownNow();
        }
    }

    @Test
    void captureKeepsStreamsApart() {
        CommandResult result = runner.capture(List.of("/bin/sh", "-c", "echo changed; echo warning 1>&2; exit 3"));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("changed\n");
        assertThat(result.stderr()).isEqualTo("warning\n");
        assertThat(result.diagnostic()).isEqualTo("warning");
    }

    @Test
    void largeStderrIsDrainedOnOutputExecutor() {
        // well past a pipe buffer, so the tool blocks unless stderr is read while stdout is
        CommandResult result = runner.capture(List.of(
            "/bin/sh", "-c", "i=0; while [ $i -lt 4000 ]; do echo warning-line-$i 1>&2; i=$((i+1)); done; echo done"));

        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout()).isEqualTo("done\n");
        assertThat(result.stderr().lines().count()).isEqualTo(4000);
        assertThat(drainedOnOutputExecutor).hasValue(1);
    }

    @Test
    void appendToKeepsExistingContentAndMergesStreams() throws IOException {
        Path log = tmp.resolve("run.log");
        Files.writeString(log, "# header\n\n");

        int exitCode = runner.appendTo(List.of("/bin/sh", "-c", "echo out; echo err 1>&2"), log);

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(log)).startsWith("# header", "").contains("out", "err");
    }

    @Test
    void missingBinaryRaisesSyncToolException() {
        assertThatThrownBy(() -> runner.capture(List.of(tmp.resolve("no-such-rsync").toString(), "-a")))
            .isInstanceOf(SyncToolException.class)
            .hasMessageContaining("no-such-rsync");
    }
}
