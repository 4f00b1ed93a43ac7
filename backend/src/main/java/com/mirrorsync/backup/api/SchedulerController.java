package com.mirrorsync.backup.api;

import com.mirrorsync.backup.model.SchedulerStatusResponse;
import com.mirrorsync.backup.service.JobScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final JobScheduler scheduler;

    public SchedulerController(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return scheduler.status();
    }
}
