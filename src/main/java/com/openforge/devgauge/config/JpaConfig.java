package com.openforge.devgauge.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Populates the @CreatedDate / @LastModifiedDate columns of BaseEntity.
 * Chat listings are ordered by the update time this maintains.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
