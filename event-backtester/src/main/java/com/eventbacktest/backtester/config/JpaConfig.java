package com.eventbacktest.backtester.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the securities master and run history.
 * Auditing fills the created/updated timestamps on daily prices and runs.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.eventbacktest.backtester.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
