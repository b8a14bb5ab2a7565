package com.buildscheduler.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "scheduler")
@Getter
@Setter
public class SchedulerProperties {

    /** Threads running one-shot timers and cron triggers. */
    private int poolSize = 4;

    /** Zone for interpreting execute-at times and cron expressions. Blank means the system zone. */
    private String zone;

    private BuildServer buildServer = new BuildServer();

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    @Getter
    @Setter
    public static class BuildServer {
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
    }
}
