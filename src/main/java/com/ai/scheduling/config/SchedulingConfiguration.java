package com.ai.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
public class SchedulingConfiguration {

    @Bean
    public Clock schedulingClock(SchedulingProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
