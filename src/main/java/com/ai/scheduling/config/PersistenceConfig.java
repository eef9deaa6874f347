package com.ai.scheduling.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.ai.scheduling.repository")
@EntityScan(basePackages = "com.ai.scheduling.entity")
public class PersistenceConfig {
}
