package org.openphc.exposure.keyserver.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA configuration for the exposure and authorized-app tables.
 */
@Configuration
@EnableJpaRepositories(basePackages = "org.openphc.exposure.keyserver.domain.repository")
@EnableTransactionManagement
public class JpaConfig {
}
