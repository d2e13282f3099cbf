package com.panwatch.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Bounds for calls into analysis providers. Only transient failures are retried,
 * waiting {@code retryWait} between attempts.
 */
@Data
@Component
@ConfigurationProperties(prefix = "panwatch.analysis")
public class AnalysisProperties {

    private Duration timeout = Duration.ofSeconds(60);
    private int maxAttempts = 3;
    private Duration retryWait = Duration.ofSeconds(2);

    /** Chars of previous analysis quoted back into a prompt. */
    private int contextExcerptLength = 300;
}
