package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * DingTalk custom robot. Config: token (the access_token), optional secret for signed robots.
 * Signature is HmacSHA256 over "timestamp\nsecret" keyed by the secret.
 */
@Component
public class DingTalkSender extends AbstractChannelSender {

    static final String API_URL = "https://oapi.dingtalk.com/robot/send?access_token=";

    private final Clock clock;

    public DingTalkSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine, Clock clock) {
        super(restTemplate, templateEngine);
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.DINGTALK;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String token = required(channel, "token");
        String secret = optional(channel, "secret", null);

        String url = API_URL + token;
        if (secret != null) {
            long timestamp = clock.millis();
            String sign = hmacSha256Base64(secret, timestamp + "\n" + secret);
            url += "&timestamp=" + timestamp + "&sign=" + URLEncoder.encode(sign, StandardCharsets.UTF_8);
        }

        Map<String, Object> payload = Map.of(
                "msgtype", "markdown",
                "markdown", Map.of("title", alert.getTitle(), "text", templateEngine.render(alert, type())));

        Map<String, Object> body = postJson(url, payload);
        expectField(body, "errcode", 0, "errmsg");
    }
}
