package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** ServerChan (Server酱) Turbo. Config: sendkey. */
@Component
public class ServerChanSender extends AbstractChannelSender {

    static final String API_URL = "https://sctapi.ftqq.com/%s.send";

    public ServerChanSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.SERVERCHAN;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String sendKey = required(channel, "sendkey");

        Map<String, Object> payload = Map.of("title", alert.getTitle(), "desp", templateEngine.render(alert, type()));

        Map<String, Object> body = postJson(String.format(API_URL, sendKey), payload);
        expectField(body, "code", 0, "message");
    }
}
