package com.buildscheduler.model.enums;

import java.util.Locale;

public enum ExecutionStatus {
    STARTED,
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != STARTED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
