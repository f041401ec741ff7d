package org.openphc.exposure.keyserver.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Publish acceptance policy, bound from {@code keyserver.publish.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "keyserver.publish")
public class PublishProperties {

    @Min(1)
    @Max(21)
    private int maxExposureKeys = 21;

    /** How far back a key's start interval may lie. */
    @NotNull
    private Duration maxIntervalStartAge = Duration.ofDays(15);

    /** Granularity of the created_at timestamp on stored exposures. */
    @NotNull
    private Duration truncateWindow = Duration.ofHours(1);

    // Test/backfill environments only.
    private boolean skipKeyDateValidation = false;
}
