package com.mirrorsync.backup.model;

public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
