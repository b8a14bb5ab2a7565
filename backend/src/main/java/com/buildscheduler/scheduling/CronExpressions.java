package com.buildscheduler.scheduling;

import org.springframework.scheduling.support.CronExpression;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cron handling shared by validation and arming. Accepts standard five-field Unix
 * expressions as well as Spring's six-field form with seconds.
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    /**
     * Normalize cron expression: if user provides 5 fields (standard Unix cron),
     * prepend "0 " to add seconds field. Spring CronExpression requires 6 fields.
     */
    public static String normalize(String cronExpression) {
        String trimmed = cronExpression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            return "0 " + trimmed;
        }
        return trimmed;
    }

    /**
     * @return the normalized expression
     * @throws IllegalArgumentException if the expression is missing or malformed
     */
    public static String validate(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String normalized = normalize(cronExpression);
        try {
            CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + e.getMessage());
        }
        return normalized;
    }

    public static LocalDateTime next(String cronExpression, LocalDateTime after) {
        try {
            return CronExpression.parse(normalize(cronExpression)).next(after);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static List<LocalDateTime> nextFireTimes(String cronExpression, LocalDateTime after, int count) {
        CronExpression cron = CronExpression.parse(validate(cronExpression));
        List<LocalDateTime> fireTimes = new ArrayList<>();
        LocalDateTime next = after;
        for (int i = 0; i < count; i++) {
            next = cron.next(next);
            if (next == null) break;
            fireTimes.add(next);
        }
        return fireTimes;
    }
}
