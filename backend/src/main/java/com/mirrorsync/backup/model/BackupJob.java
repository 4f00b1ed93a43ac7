package com.mirrorsync.backup.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A scheduled directory mirror with its run history.
 *
 * <p>{@code lastRun}, {@code lastResult} and {@code lastChangeDetected} are only ever replaced
 * together through {@link #withOutcome(Instant, String, Boolean)}.
 */
public record BackupJob(
    @JsonProperty("id") String id,
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("cron") String cron,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("last_run") Instant lastRun,
    @JsonProperty("last_result") String lastResult,
    @JsonProperty("last_change_detected") Boolean lastChangeDetected
) {

    public static BackupJob create(String id, String source, String target, String cron, boolean enabled) {
        return new BackupJob(id, source, target, cron, enabled, null, null, null);
    }

    public BackupJob withDefinition(String source, String target, String cron, boolean enabled) {
        return new BackupJob(id, source, target, cron, enabled, lastRun, lastResult, lastChangeDetected);
    }

    public BackupJob withEnabled(boolean enabled) {
        return new BackupJob(id, source, target, cron, enabled, lastRun, lastResult, lastChangeDetected);
    }

    public BackupJob withOutcome(Instant lastRun, String lastResult, Boolean lastChangeDetected) {
        return new BackupJob(id, source, target, cron, enabled, lastRun, lastResult, lastChangeDetected);
    }
}
