package com.buildscheduler.model.enums;

public enum TriggerType {
    SCHEDULED,
    MANUAL
}
