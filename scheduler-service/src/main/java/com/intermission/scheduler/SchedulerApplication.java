package com.intermission.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling   // drives the admission tick
public class SchedulerApplication {
    public static void main(String[] args) { SpringApplication.run(SchedulerApplication.class, args); }
}
