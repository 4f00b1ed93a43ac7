package com.mirrorsync.backup.service;

import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.model.RunOutcome;
import com.mirrorsync.backup.model.RunTrigger;
import com.mirrorsync.backup.rsync.ChangeDetector;
import com.mirrorsync.backup.rsync.DetectionException;
import com.mirrorsync.backup.rsync.SyncExecutor;
import com.mirrorsync.backup.rsync.SyncToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Probe, then mirror only if the probe found changes, then record the outcome on the job.
 * Callers must hold the job's execution slot.
 */
@Service
public class BackupPipeline {
    private static final Logger log = LoggerFactory.getLogger(BackupPipeline.class);
    static final String SKIPPED_RESULT = "No changes - skipped";

    private final ChangeDetector changeDetector;
    private final SyncExecutor syncExecutor;
    private final JobTable jobTable;
    private final Clock clock;

    public BackupPipeline(ChangeDetector changeDetector, SyncExecutor syncExecutor, JobTable jobTable, Clock clock) {
        this.changeDetector = changeDetector;
        this.syncExecutor = syncExecutor;
        this.jobTable = jobTable;
        this.clock = clock;
    }

    /**
     * @return the job with its new outcome; if the job was deleted meanwhile, an unsaved copy carrying it
     * @throws com.mirrorsync.backup.persistence.JobStoreException if the outcome cannot be persisted
     */
    public BackupJob run(BackupJob job, RunTrigger trigger) {
        Instant startedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        log.info("Starting {} run of job {} ({} -> {})", trigger, job.id(), job.source(), job.target());

        boolean changed;
        try {
            changed = changeDetector.hasChanges(job.source(), job.target());
        } catch (DetectionException | SyncToolException e) {
            log.warn("Change detection failed for job {}: {}", job.id(), e.getMessage());
            return record(job, startedAt, "ERROR: " + e.getMessage(), null);
        }

        if (!changed) {
            log.info("Job {} has no changes, skipping mirror", job.id());
            return record(job, startedAt, SKIPPED_RESULT, false);
        }

        String result;
        try {
            RunOutcome outcome = syncExecutor.execute(job.source(), job.target(), job.id());
            result = outcome.summary();
        } catch (SyncToolException e) {
            log.warn("Mirror could not run for job {}: {}", job.id(), e.getMessage());
            result = "ERROR: " + e.getMessage();
        }
        return record(job, startedAt, result, true);
    }

    private BackupJob record(BackupJob job, Instant startedAt, String result, Boolean changed) {
        return jobTable.recordOutcome(job.id(), startedAt, result, changed)
            .orElseGet(() -> {
                log.info("Job {} was removed during its run, dropping outcome '{}'", job.id(), result);
                return job.withOutcome(startedAt, result, changed);
            });
    }
}
