package com.buildscheduler.model.enums;

import java.util.Locale;

public enum ScheduleKind {
    ONCE,
    RECURRING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScheduleKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Schedule kind is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Schedule kind must be 'once' or 'recurring'");
        }
    }
}
