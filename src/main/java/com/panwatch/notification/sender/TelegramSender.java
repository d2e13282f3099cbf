package com.panwatch.notification.sender;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;
import com.panwatch.notification.Alert;
import com.panwatch.notification.NotificationTemplateEngine;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Telegram Bot API sendMessage. Config: bot_token, chat_id.
 * Plain text without parse_mode because AI output is not HTML-safe.
 */
@Component
public class TelegramSender extends AbstractChannelSender {

    static final String API_URL = "https://api.telegram.org/bot%s/sendMessage";

    public TelegramSender(RestTemplate restTemplate, NotificationTemplateEngine templateEngine) {
        super(restTemplate, templateEngine);
    }

    @Override
    public ChannelType type() {
        return ChannelType.TELEGRAM;
    }

    @Override
    public void send(NotifyChannel channel, Alert alert) {
        String token = required(channel, "bot_token");
        String chatId = required(channel, "chat_id");

        Map<String, Object> payload = Map.of(
                "chat_id", chatId,
                "text", templateEngine.render(alert, type()),
                "disable_web_page_preview", true);

        Map<String, Object> body = postJson(String.format(API_URL, token), payload);
        expectField(body, "ok", true, "description");
    }
}
