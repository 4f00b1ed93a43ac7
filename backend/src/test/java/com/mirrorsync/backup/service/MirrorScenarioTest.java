package com.mirrorsync.backup.service;

import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.persistence.JobJsonRepository;
import com.mirrorsync.backup.rsync.ChangeDetector;
import com.mirrorsync.backup.rsync.ProcessRsyncCommandRunner;
import com.mirrorsync.backup.rsync.RsyncCommands;
import com.mirrorsync.backup.rsync.SyncExecutor;
import com.mirrorsync.config.MirrorSyncConfig;
import com.mirrorsync.config.MirrorSyncProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * End-to-end firings against a real rsync binary; skipped where rsync is not installed.
 */
class MirrorScenarioTest {

    @TempDir
    Path tmp;

    private ScheduledThreadPoolExecutor timer;
    private ExecutorService workers;
    private ExecutorService outputPool;
    private JobTable jobTable;
    private JobScheduler scheduler;
    private Path logDir;

    @BeforeEach
    void setUp() {
        assumeTrue(rsyncAvailable(), "rsync is not installed");
        MirrorSyncProperties properties = new MirrorSyncProperties();
        properties.getStorage().setDataDir(tmp.resolve("data").toString());
        logDir = properties.getStorage().resolveLogDir();
        Clock clock = Clock.systemUTC();

        RsyncCommands commands = new RsyncCommands(properties);
        outputPool = Executors.newCachedThreadPool();
        ProcessRsyncCommandRunner runner = new ProcessRsyncCommandRunner(outputPool);
        jobTable = new JobTable(new JobJsonRepository(new MirrorSyncConfig().objectMapper(), properties));
        jobTable.load();
        BackupPipeline pipeline = new BackupPipeline(
            new ChangeDetector(commands, runner),
            new SyncExecutor(commands, runner, properties, clock),
            jobTable,
            clock
        );
        timer = new ScheduledThreadPoolExecutor(1);
        workers = Executors.newSingleThreadExecutor();
        scheduler = new JobScheduler(jobTable, pipeline, new ExecutionSlots(), timer, workers, properties, clock);
    }

    @AfterEach
    void tearDown() {
        if (timer != null) {
            timer.shutdownNow();
            workers.shutdownNow();
            outputPool.shutdownNow();
        }
    }

    @Test
    void firstFiringMirrorsThenRepeatFiringSkips() throws IOException {
        Path src = Files.createDirectories(tmp.resolve("src"));
        // rsync reports an empty source as changed only through the root directory's mtime
        // (".d..t...... ./"), so the source mtime must differ from the freshly created target's
        Files.setLastModifiedTime(src, FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
        Path dst = tmp.resolve("dst");
        BackupJob job = BackupJob.create("a00000000001", src.toString(), dst.toString(), "* * * * *", true);
        jobTable.insert(job);

        scheduler.fire(job.id());

        BackupJob first = jobTable.find(job.id()).orElseThrow();
        assertThat(dst).isDirectory();
        assertThat(first.lastChangeDetected()).isTrue();
        assertThat(first.lastResult()).startsWith("OK - log: ");
        assertThat(first.lastRun()).isNotNull();
        assertThat(logFiles()).hasSize(1);

        scheduler.fire(job.id());

        BackupJob second = jobTable.find(job.id()).orElseThrow();
        assertThat(second.lastChangeDetected()).isFalse();
        assertThat(second.lastResult()).isEqualTo(BackupPipeline.SKIPPED_RESULT);
        assertThat(logFiles()).hasSize(1);
    }

    @Test
    void mirrorDeletesTargetOnlyEntries() throws IOException {
        Path src = Files.createDirectories(tmp.resolve("src"));
        Files.writeString(src.resolve("keep.txt"), "keep");
        Path dst = Files.createDirectories(tmp.resolve("dst"));
        Files.writeString(dst.resolve("stale.txt"), "stale");
        BackupJob job = BackupJob.create("a00000000002", src.toString(), dst.toString(), "0 2 * * *", true);
        jobTable.insert(job);

        BackupJob ran = scheduler.runNow(job.id());

        assertThat(ran.lastChangeDetected()).isTrue();
        assertThat(dst.resolve("keep.txt")).hasContent("keep");
        assertThat(dst.resolve("stale.txt")).doesNotExist();
        Path log = logFiles().get(0);
        assertThat(Files.readAllLines(log).get(0)).contains("rsync " + src + " -> " + dst);
    }

    private List<Path> logFiles() throws IOException {
        if (!Files.isDirectory(logDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(logDir)) {
            return files.toList();
        }
    }

    private static boolean rsyncAvailable() {
        try {
            Process process = new ProcessBuilder("rsync", "--version").redirectErrorStream(true).start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
