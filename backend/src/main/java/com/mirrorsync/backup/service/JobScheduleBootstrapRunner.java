package com.mirrorsync.backup.service;

import com.mirrorsync.backup.model.BackupJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Arms timers for all enabled jobs once the job table is loaded.
 */
@Component
public class JobScheduleBootstrapRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(JobScheduleBootstrapRunner.class);

    private final JobTable jobTable;
    private final BackupJobService jobService;

    public JobScheduleBootstrapRunner(JobTable jobTable, BackupJobService jobService) {
        this.jobTable = jobTable;
        this.jobService = jobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int armed = 0;
        int failed = 0;
        for (BackupJob job : jobTable.snapshot()) {
            if (!job.enabled()) {
                continue;
            }
            try {
                jobService.createOrReplaceSchedule(job);
                armed++;
            } catch (InvalidScheduleException e) {
                failed++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to schedule job {} on startup", job.id(), e);
            }
        }
        log.info("Scheduled {} enabled jobs on startup ({} failed)", armed, failed);
    }
}
