package com.ai.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.scheduling")
public class InterviewSchedulingApplication {

    public static void main(String[] args) {
        SpringApplication.run(InterviewSchedulingApplication.class, args);
    }
}
