package com.panwatch.notification;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Channel delivery settings.
 *
 * <pre>
 * panwatch.notification.timeout=10s
 * panwatch.notification.test-title=PanWatch test
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "panwatch.notification")
public class NotificationProperties {

    /** Bound on one channel send, also used as the HTTP connect/read timeout. */
    private Duration timeout = Duration.ofSeconds(10);

    private String testTitle = "PanWatch test";
    private String testMessage = "This is a test notification from PanWatch.";
}
