package com.mirrorsync.backup.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One execution slot per job id, shared by timer firings and manual runs. A slot is held from the
 * moment a run is claimed until it completes, so it covers both pending and running executions.
 * Release may happen on a different thread than the claim.
 */
@Component
public class ExecutionSlots {
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String jobId) {
        return claimed.add(jobId);
    }

    public void release(String jobId) {
        claimed.remove(jobId);
    }

    public boolean isHeld(String jobId) {
        return claimed.contains(jobId);
    }

    public List<String> heldJobIds() {
        return claimed.stream().sorted().toList();
    }
}
