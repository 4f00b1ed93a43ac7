package com.mirrorsync.backup.service;

import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.persistence.JobJsonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory job table, the single owner of all job records.
 *
 * <p>All reads and writes go through one lock. A mutation is applied to a copy of the table, the
 * copy is saved in full, and only a successful save publishes it. When the save fails the table
 * stays at the last persisted snapshot and the {@link com.mirrorsync.backup.persistence.JobStoreException}
 * propagates.
 */
@Component
public class JobTable {
    private static final Logger log = LoggerFactory.getLogger(JobTable.class);

    private final JobJsonRepository repository;
    private final Object lock = new Object();

    private Map<String, BackupJob> jobs = Map.of();

    public JobTable(JobJsonRepository repository) {
        this.repository = repository;
    }

    @PostConstruct
    public void load() {
        Map<String, BackupJob> loaded = repository.load();
        synchronized (lock) {
            jobs = new LinkedHashMap<>(loaded);
        }
        log.info("Loaded {} backup jobs from {}", loaded.size(), repository.getJobsFile());
    }

    public List<BackupJob> snapshot() {
        synchronized (lock) {
            return List.copyOf(jobs.values());
        }
    }

    public Optional<BackupJob> find(String jobId) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(jobId));
        }
    }

    public BackupJob insert(BackupJob job) {
        synchronized (lock) {
            if (jobs.containsKey(job.id())) {
                throw new IllegalStateException("Duplicate job id " + job.id());
            }
            Map<String, BackupJob> next = new LinkedHashMap<>(jobs);
            next.put(job.id(), job);
            commit(next);
            return job;
        }
    }

    /**
     * Applies {@code change} to the job and persists the table.
     *
     * @return the updated job, or empty if no job has that id
     */
    public Optional<BackupJob> update(String jobId, UnaryOperator<BackupJob> change) {
        synchronized (lock) {
            BackupJob current = jobs.get(jobId);
            if (current == null) {
                return Optional.empty();
            }
            BackupJob updated = change.apply(current);
            if (!updated.id().equals(jobId)) {
                throw new IllegalArgumentException("Job id is immutable: " + jobId);
            }
            Map<String, BackupJob> next = new LinkedHashMap<>(jobs);
            next.put(jobId, updated);
            commit(next);
            return Optional.of(updated);
        }
    }

    /**
     * Writes the outcome triple of one run.
     *
     * @return the updated job, or empty if the job was deleted while it ran
     */
    public Optional<BackupJob> recordOutcome(String jobId, Instant lastRun, String lastResult, Boolean lastChangeDetected) {
        return update(jobId, job -> job.withOutcome(lastRun, lastResult, lastChangeDetected));
    }

    public Optional<BackupJob> remove(String jobId) {
        synchronized (lock) {
            BackupJob current = jobs.get(jobId);
            if (current == null) {
                return Optional.empty();
            }
            Map<String, BackupJob> next = new LinkedHashMap<>(jobs);
            next.remove(jobId);
            commit(next);
            return Optional.of(current);
        }
    }

    private void commit(Map<String, BackupJob> next) {
        repository.save(next);
        jobs = next;
    }
}
