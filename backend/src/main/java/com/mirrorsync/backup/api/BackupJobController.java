package com.mirrorsync.backup.api;

import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.backup.model.JobRequest;
import com.mirrorsync.backup.service.BackupJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class BackupJobController {
    private final BackupJobService jobService;

    public BackupJobController(BackupJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    public List<BackupJob> listJobs() {
        return jobService.listJobs();
    }

    @GetMapping("/{jobId}")
    public BackupJob getJob(@PathVariable("jobId") String jobId) {
        return jobService.getJob(jobId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BackupJob createJob(@RequestBody(required = false) JobRequest request) {
        return jobService.create(request);
    }

    @PutMapping("/{jobId}")
    public BackupJob updateJob(@PathVariable("jobId") String jobId, @RequestBody(required = false) JobRequest request) {
        return jobService.update(jobId, request);
    }

    @PostMapping("/{jobId}/toggle")
    public BackupJob toggleJob(@PathVariable("jobId") String jobId) {
        return jobService.toggle(jobId);
    }

    @PostMapping("/{jobId}/enable")
    public BackupJob enableJob(@PathVariable("jobId") String jobId) {
        return jobService.enable(jobId);
    }

    @PostMapping("/{jobId}/disable")
    public BackupJob disableJob(@PathVariable("jobId") String jobId) {
        return jobService.disable(jobId);
    }

    /**
     * Runs the job synchronously; the response carries the recorded outcome.
     */
    @PostMapping("/{jobId}/run")
    public BackupJob runJob(@PathVariable("jobId") String jobId) {
        return jobService.runNow(jobId);
    }

    @DeleteMapping("/{jobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteJob(@PathVariable("jobId") String jobId) {
        jobService.delete(jobId);
    }
}
