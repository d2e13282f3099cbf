package com.panwatch.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wall clock in the scheduler zone. Tests pass a fixed clock instead. */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(SchedulerProperties schedulerProperties) {
        return Clock.system(schedulerProperties.zoneId());
    }
}
