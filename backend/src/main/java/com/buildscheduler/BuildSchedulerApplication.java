package com.buildscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BuildSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BuildSchedulerApplication.class, args);
    }
}
