package com.mirrorsync.backup.service;

import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.model.JobRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Job lifecycle operations. Keeps the job table and the scheduler's timers in agreement: every
 * enabled job has exactly one timer, every disabled or deleted job has none. A job whose cron
 * expression is rejected is kept, but disabled, with the scheduling error recorded as its last outcome.
 * Lifecycle changes are serialized so a concurrent enable and disable cannot leave a disabled job armed.
 */
@Service
public class BackupJobService {
    private static final Logger log = LoggerFactory.getLogger(BackupJobService.class);
    private static final int ID_LENGTH = 12;

    private final JobTable jobTable;
    private final JobScheduler scheduler;
    private final Clock clock;
    private final Object lifecycleLock = new Object();

    public BackupJobService(JobTable jobTable, JobScheduler scheduler, Clock clock) {
        this.jobTable = jobTable;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public List<BackupJob> listJobs() {
        return jobTable.snapshot();
    }

    public BackupJob getJob(String jobId) {
        return jobTable.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * @throws InvalidJobRequestException if a path is missing or relative, or the source does not exist
     * @throws InvalidScheduleException if the cron expression is invalid; the job is still created, disabled
     */
    public BackupJob create(JobRequest request) {
        synchronized (lifecycleLock) {
            validate(request);
            if (!Files.exists(Path.of(request.source()))) {
                throw new InvalidJobRequestException("Source does not exist: " + request.source());
            }
            BackupJob job = BackupJob.create(
                newJobId(),
                request.source(),
                request.target(),
                request.cron().trim(),
                request.enabledOrDefault()
            );
            jobTable.insert(job);
            log.info("Created job {} ({} -> {}, cron '{}')", job.id(), job.source(), job.target(), job.cron());
            return createOrReplaceSchedule(job);
        }
    }

    /**
     * Replaces source, target, cron and enabled flag, keeping the run history.
     */
    public BackupJob update(String jobId, JobRequest request) {
        synchronized (lifecycleLock) {
            validate(request);
            BackupJob updated = jobTable.update(jobId, job -> job.withDefinition(
                    request.source(),
                    request.target(),
                    request.cron().trim(),
                    request.enabledOrDefault()
                ))
                .orElseThrow(() -> new JobNotFoundException(jobId));
            return createOrReplaceSchedule(updated);
        }
    }

    /**
     * Arms the job's timer if its stored record is enabled, disarms it otherwise.
     *
     * @throws InvalidScheduleException if an enabled job's cron cannot be parsed; the job is disabled
     */
    public BackupJob createOrReplaceSchedule(BackupJob job) {
        synchronized (lifecycleLock) {
            BackupJob current = getJob(job.id());
            if (!current.enabled()) {
                scheduler.disarm(current.id());
                return current;
            }
            try {
                scheduler.arm(current);
                return current;
            } catch (InvalidScheduleException e) {
                markUnschedulable(current.id(), e);
                throw e;
            }
        }
    }

    public BackupJob enable(String jobId) {
        return setEnabled(jobId, true);
    }

    public BackupJob disable(String jobId) {
        return setEnabled(jobId, false);
    }

    public BackupJob toggle(String jobId) {
        synchronized (lifecycleLock) {
            return setEnabled(jobId, !getJob(jobId).enabled());
        }
    }

    public BackupJob runNow(String jobId) {
        return scheduler.runNow(jobId);
    }

    /**
     * Cancels the job's timer, then removes the record. A run already in flight completes.
     */
    public void delete(String jobId) {
        synchronized (lifecycleLock) {
            getJob(jobId);
            scheduler.disarm(jobId);
            jobTable.remove(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            log.info("Deleted job {}", jobId);
        }
    }

    /**
     * Disables the job and records the scheduling error as a complete outcome, so no field of an
     * earlier run survives next to it.
     */
    void markUnschedulable(String jobId, InvalidScheduleException cause) {
        scheduler.disarm(jobId);
        Instant at = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        String result = "ERROR scheduling: " + cause.getMessage();
        jobTable.update(jobId, job -> job.withEnabled(false).withOutcome(at, result, null));
        log.warn("Job {} disabled: {}", jobId, cause.getMessage());
    }

    private BackupJob setEnabled(String jobId, boolean enabled) {
        synchronized (lifecycleLock) {
            BackupJob updated = jobTable.update(jobId, job -> job.withEnabled(enabled))
                .orElseThrow(() -> new JobNotFoundException(jobId));
            return createOrReplaceSchedule(updated);
        }
    }

    private void validate(JobRequest request) {
        if (request == null) {
            throw new InvalidJobRequestException("Request body is required");
        }
        requireAbsolute("source", request.source());
        requireAbsolute("target", request.target());
        if (request.cron() == null || request.cron().isBlank()) {
            throw new InvalidJobRequestException("cron is required");
        }
    }

    private void requireAbsolute(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidJobRequestException(field + " is required");
        }
        if (!value.startsWith("/")) {
            throw new InvalidJobRequestException(field + " must be an absolute path (starting with /): " + value);
        }
    }

    private static String newJobId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, ID_LENGTH);
    }
}
