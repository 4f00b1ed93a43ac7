package com.mirrorsync.backup.service;

import com.cronutils.model.time.ExecutionTime;
import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.model.RunTrigger;
import com.mirrorsync.backup.model.SchedulerStatusResponse;
import com.mirrorsync.backup.util.CronSchedules;
import com.mirrorsync.config.MirrorSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns one cron timer per armed job and runs the backup pipeline when a timer fires.
 *
 * <p>Timer firings and {@link #runNow(String)} share the per-job {@link ExecutionSlots}, so at most
 * one run per job is pending or in flight. A tick that finds the slot taken is dropped, and a
 * tick delayed past the misfire grace window is dropped as missed. Runs are never cancelled:
 * disarming a job only stops future ticks.
 */
@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobTable jobTable;
    private final BackupPipeline pipeline;
    private final ExecutionSlots slots;
    private final ScheduledExecutorService scheduleTimer;
    private final ExecutorService backupExecutor;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration misfireGrace;
    private final Map<String, ArmedSchedule> armed = new HashMap<>();

    public JobScheduler(
        JobTable jobTable,
        BackupPipeline pipeline,
        ExecutionSlots slots,
        @Qualifier("scheduleTimer") ScheduledExecutorService scheduleTimer,
        @Qualifier("backupExecutor") ExecutorService backupExecutor,
        MirrorSyncProperties properties,
        Clock clock
    ) {
        this.jobTable = jobTable;
        this.pipeline = pipeline;
        this.slots = slots;
        this.scheduleTimer = scheduleTimer;
        this.backupExecutor = backupExecutor;
        this.clock = clock;
        this.zone = properties.getScheduler().zoneId();
        this.misfireGrace = Duration.ofSeconds(properties.getScheduler().getMisfireGraceSeconds());
    }

    /**
     * Arms a timer for the job's cron expression, replacing any timer already armed for its id.
     *
     * @throws InvalidScheduleException if the expression cannot be parsed; the job is left unarmed
     */
    public void arm(BackupJob job) {
        ExecutionTime executionTime;
        try {
            executionTime = CronSchedules.parse(job.cron());
        } catch (InvalidScheduleException e) {
            disarm(job.id());
            throw e;
        }
        synchronized (armed) {
            ArmedSchedule previous = armed.remove(job.id());
            if (previous != null) {
                previous.cancel();
            }
            ArmedSchedule schedule = new ArmedSchedule(job.id(), job.cron(), executionTime);
            armed.put(job.id(), schedule);
            scheduleNext(schedule, clock.instant());
        }
        log.info("Armed job {} with cron '{}' ({})", job.id(), job.cron(), zone);
    }

    /**
     * Cancels the job's timer. Not having one is not an error.
     *
     * @return whether a timer was removed
     */
    public boolean disarm(String jobId) {
        synchronized (armed) {
            ArmedSchedule removed = armed.remove(jobId);
            if (removed == null) {
                return false;
            }
            removed.cancel();
        }
        log.info("Disarmed job {}", jobId);
        return true;
    }

    public boolean isArmed(String jobId) {
        synchronized (armed) {
            return armed.containsKey(jobId);
        }
    }

    public List<String> armedJobIds() {
        synchronized (armed) {
            List<String> ids = new ArrayList<>(armed.keySet());
            ids.sort(null);
            return ids;
        }
    }

    public Optional<Instant> nextFireTime(String jobId) {
        synchronized (armed) {
            ArmedSchedule schedule = armed.get(jobId);
            return schedule == null ? Optional.empty() : Optional.ofNullable(schedule.nextFireTime);
        }
    }

    public SchedulerStatusResponse status() {
        return new SchedulerStatusResponse(zone.getId(), misfireGrace.toSeconds(), armedJobIds(), slots.heldJobIds());
    }

    /**
     * Runs the pipeline for the job on the calling thread. A disabled job is returned unchanged
     * without running, as a timer tick would treat it.
     *
     * @throws JobNotFoundException if no job has that id
     * @throws JobAlreadyRunningException if a run for the job is pending or in flight
     */
    public BackupJob runNow(String jobId) {
        jobTable.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!slots.tryAcquire(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }
        try {
            BackupJob job = jobTable.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (!job.enabled()) {
                log.info("Job {} is disabled, manual run skipped", jobId);
                return job;
            }
            return pipeline.run(job, RunTrigger.MANUAL);
        } finally {
            slots.release(jobId);
        }
    }

    @PreDestroy
    public void disarmAll() {
        synchronized (armed) {
            armed.values().forEach(ArmedSchedule::cancel);
            armed.clear();
        }
    }

    /**
     * Hands a due tick to the worker pool.
     *
     * @return whether a run was submitted
     */
    boolean dispatch(String jobId, Instant scheduledFor) {
        Duration lateness = Duration.between(scheduledFor, clock.instant());
        if (lateness.compareTo(misfireGrace) > 0) {
            log.warn("Missed run of job {} scheduled for {} ({}s late), skipping", jobId, scheduledFor, lateness.toSeconds());
            return false;
        }
        if (!slots.tryAcquire(jobId)) {
            log.info("Job {} is still running, coalescing tick scheduled for {}", jobId, scheduledFor);
            return false;
        }
        try {
            backupExecutor.execute(() -> {
                try {
                    fire(jobId);
                } finally {
                    slots.release(jobId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            slots.release(jobId);
            log.warn("Backup executor rejected run of job {}", jobId, e);
            return false;
        }
    }

    /**
     * Timer callback body. A job that is gone or disabled is skipped silently; failures are logged
     * and never reach the timer.
     */
    void fire(String jobId) {
        Optional<BackupJob> job = jobTable.find(jobId);
        if (job.isEmpty() || !job.get().enabled()) {
            log.debug("Skipping tick for job {}: missing or disabled", jobId);
            return;
        }
        try {
            pipeline.run(job.get(), RunTrigger.SCHEDULED);
        } catch (RuntimeException e) {
            log.error("Scheduled run of job {} failed", jobId, e);
        }
    }

    private void onTick(ArmedSchedule schedule, Instant scheduledFor) {
        try {
            Instant now = clock.instant();
            synchronized (armed) {
                if (armed.get(schedule.jobId) != schedule) {
                    return;
                }
                scheduleNext(schedule, now.isAfter(scheduledFor) ? now : scheduledFor);
            }
            dispatch(schedule.jobId, scheduledFor);
        } catch (RuntimeException e) {
            log.error("Timer tick for job {} failed", schedule.jobId, e);
        }
    }

    // caller holds the armed lock
    private void scheduleNext(ArmedSchedule schedule, Instant after) {
        Optional<ZonedDateTime> next = schedule.executionTime.nextExecution(after.atZone(zone));
        if (next.isEmpty()) {
            schedule.nextFireTime = null;
            log.warn("Cron '{}' of job {} has no future execution time", schedule.cron, schedule.jobId);
            return;
        }
        Instant fireAt = next.get().toInstant();
        long delayMs = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        schedule.nextFireTime = fireAt;
        schedule.future = scheduleTimer.schedule(() -> onTick(schedule, fireAt), delayMs, TimeUnit.MILLISECONDS);
    }

    private static final class ArmedSchedule {
        private final String jobId;
        private final String cron;
        private final ExecutionTime executionTime;
        private ScheduledFuture<?> future;
        private Instant nextFireTime;

        private ArmedSchedule(String jobId, String cron, ExecutionTime executionTime) {
            this.jobId = jobId;
            this.cron = cron;
            this.executionTime = executionTime;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
