package com.panwatch.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "panwatch.datasource")
public class DataSourceProperties {

    /** Upper bound of a single provider attempt. */
    private Duration timeout = Duration.ofSeconds(15);
}
