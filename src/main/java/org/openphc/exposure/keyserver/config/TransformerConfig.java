package org.openphc.exposure.keyserver.config;

import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.publish.ExposureTransformer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Publish pipeline wiring: the transformer is built once from {@link PublishProperties}
 * and never mutated afterwards.
 */
@Configuration
@EnableConfigurationProperties(PublishProperties.class)
@Slf4j
public class TransformerConfig {

    @Bean
    public ExposureTransformer exposureTransformer(PublishProperties properties) {
        log.info("Publish policy: maxExposureKeys={}, maxIntervalStartAge={}, truncateWindow={}",
                properties.getMaxExposureKeys(), properties.getMaxIntervalStartAge(),
                properties.getTruncateWindow());
        return new ExposureTransformer(
                properties.getMaxExposureKeys(),
                properties.getMaxIntervalStartAge(),
                properties.getTruncateWindow(),
                properties.isSkipKeyDateValidation());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
