package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/** WeCom (企业微信) group robot. Config: webhook_key. */
@Component
public class WeComSender extends AbstractChannelSender {

    static final String API_URL = "https://qyapi.weixin.qq.com/cgi-bin/webhook/send?key=";

    /** Markdown content limit in bytes is 4096; stay well under it in chars. */
    private static final int MAX_CHARS = 1300;

    public WeComSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.WECOM;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String key = required(channel, "webhook_key");
        String content = templateEngine.render(alert, type());
        if (content.length() > MAX_CHARS) {
            content = content.substring(0, MAX_CHARS) + "...";
        }

        Map<String, Object> payload = Map.of("msgtype", "markdown", "markdown", Map.of("content", content));

        Map<String, Object> body = postJson(API_URL + key, payload);
        expectField(body, "errcode", 0, "errmsg");
    }
}
