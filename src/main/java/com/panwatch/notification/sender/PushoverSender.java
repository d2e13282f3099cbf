package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** Pushover. Config: user_key, app_token. */
@Component
public class PushoverSender extends AbstractChannelSender {

    static final String API_URL = "https://api.pushover.net/1/messages.json";

    // Pushover caps message at 1024 chars
    private static final int MAX_MESSAGE = 1024;

    public PushoverSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.PUSHOVER;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String userKey = required(channel, "user_key");
        String appToken = required(channel, "app_token");

        String message = templateEngine.plainBody(alert);
        if (message.length() > MAX_MESSAGE) {
            message = message.substring(0, MAX_MESSAGE - 3) + "...";
        }

        Map<String, Object> payload = Map.of(
                "token", appToken,
                "user", userKey,
                "title", alert.getTitle(),
                "message", message);

        Map<String, Object> body = postJson(API_URL, payload);
        expectField(body, "status", 1, "errors");
    }
}
