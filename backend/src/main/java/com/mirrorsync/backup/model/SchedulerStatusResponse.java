package com.mirrorsync.backup.model;

import java.util.List;

public record SchedulerStatusResponse(
    String zone,
    long misfireGraceSeconds,
    List<String> armedJobIds,
    List<String> runningJobIds
) {
}
