package com.tigerwatch.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FacilityMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FacilityMonitorApplication.class, args);
    }
}
