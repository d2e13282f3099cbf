package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Lark / Feishu custom bot. Config: webhook_token, optional secret.
 * Signed bots use HmacSHA256 keyed by "timestamp\nsecret" over an empty message.
 */
@Component
public class LarkSender extends AbstractChannelSender {

    static final String API_URL = "https://open.feishu.cn/open-apis/bot/v2/hook/";

    private final Clock clock;

    public LarkSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine, Clock clock) {
        super(restTemplate, templateEngine);
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.LARK;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String token = required(channel, "webhook_token");
        String secret = optional(channel, "secret", null);

        Map<String, Object> payload = new HashMap<>();
        payload.put("msg_type", "text");
        payload.put("content", Map.of("text", templateEngine.render(alert, type())));
        if (secret != null) {
            long timestamp = clock.millis() / 1000;
            payload.put("timestamp", String.valueOf(timestamp));
            payload.put("sign", hmacSha256Base64(timestamp + "\n" + secret, ""));
        }

        Map<String, Object> body = postJson(API_URL + token, payload);
        expectField(body, "code", 0, "msg");
    }
}
