package com.intermission.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlatformSimulatorApplication {
    public static void main(String[] args) {
        SpringApplication.run(PlatformSimulatorApplication.class, args);
    }
}
