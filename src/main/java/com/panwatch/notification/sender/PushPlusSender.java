package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** PushPlus. Config: token, optional topic for group pushes. */
@Component
public class PushPlusSender extends AbstractChannelSender {

    static final String API_URL = "https://www.pushplus.plus/send";

    public PushPlusSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.PUSHPLUS;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String token = required(channel, "token");
        String topic = optional(channel, "topic", null);

        Map<String, Object> payload = new HashMap<>();
        payload.put("token", token);
        payload.put("title", alert.getTitle());
        payload.put("content", templateEngine.render(alert, type()));
        payload.put("template", "markdown");
        if (topic != null) {
            payload.put("topic", topic);
        }

        Map<String, Object> body = postJson(API_URL, payload);
        expectField(body, "code", 200, "msg");
    }
}
