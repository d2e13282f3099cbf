package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** Bark push (iOS). Config: device_key, optional server_url for self-hosted servers. */
@Component
public class BarkSender extends AbstractChannelSender {

    static final String DEFAULT_SERVER = "https://api.day.app";

    public BarkSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.BARK;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String deviceKey = required(channel, "device_key");
        String server = optional(channel, "server_url", DEFAULT_SERVER);
        if (!server.startsWith("http")) {
            server = "https://" + server;
        }
        if (server.endsWith("/")) {
            server = server.substring(0, server.length() - 1);
        }

        Map<String, Object> payload = Map.of(
                "device_key", deviceKey,
                "title", alert.getTitle(),
                "body", templateEngine.plainBody(alert),
                "group", "PanWatch");

        Map<String, Object> body = postJson(server + "/push", payload);
        expectField(body, "code", 200, "message");
    }
}
