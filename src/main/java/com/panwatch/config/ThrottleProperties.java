package com.panwatch.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Minimum spacing between automatic notifications of one (agent, instrument). */
@Data
@Component
@ConfigurationProperties(prefix = "panwatch.throttle")
public class ThrottleProperties {

    private Duration minInterval = Duration.ofMinutes(30);
}
