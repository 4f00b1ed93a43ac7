package com.mirrorsync.backup.model;

public record JobRequest(
    String source,
    String target,
    String cron,
    Boolean enabled
) {

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }
}
