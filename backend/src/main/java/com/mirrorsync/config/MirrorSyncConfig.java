package com.mirrorsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MirrorSyncConfig {

    @Bean(name = "scheduleTimer", destroyMethod = "shutdownNow")
    public ScheduledExecutorService scheduleTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("mirror-schedule-timer");
            thread.setDaemon(true);
            return thread;
        });
        // disarmed timers leave the queue immediately instead of at their fire time
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @Bean(name = "backupExecutor", destroyMethod = "shutdown")
    public ExecutorService backupExecutor(MirrorSyncProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getScheduler().getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("mirror-backup-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "rsyncOutputExecutor", destroyMethod = "shutdown")
    public ExecutorService rsyncOutputExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("mirror-rsync-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
