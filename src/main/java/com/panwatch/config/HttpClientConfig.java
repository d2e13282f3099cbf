package com.panwatch.config;

import com.panwatch.notification.NotificationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Shared RestTemplate for the notification channel senders. Connect and read timeouts are
 * the per-channel delivery bound so a hung webhook cannot pin a notify thread.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate notifyRestTemplate(RestTemplateBuilder builder, NotificationProperties notificationProperties) {
        return builder.setConnectTimeout(notificationProperties.getTimeout())
                .setReadTimeout(notificationProperties.getTimeout())
                .build();
    }
}
