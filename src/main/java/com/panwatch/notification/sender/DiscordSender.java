package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** Discord webhook. Config: webhook_id, webhook_token. Success is a 204 with no body. */
@Component
public class DiscordSender extends AbstractChannelSender {

    static final String API_URL = "https://discord.com/api/webhooks/%s/%s";

    public DiscordSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.DISCORD;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String id = required(channel, "webhook_id");
        String token = required(channel, "webhook_token");

        postJson(String.format(API_URL, id, token), Map.of("content", templateEngine.render(alert, type())));
    }
}
