package com.panwatch.notification;

import com.panwatch.domain.enums.ChannelType;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Renders an alert into the text flavour each push service understands.
 *
 * <p>DingTalk, WeCom, ServerChan and PushPlus take markdown; Telegram and Discord get
 * lightly formatted plain text; the rest take title and body separately and use
 * {@link #plainBody(Alert)}.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    static final int DISCORD_LIMIT = 2000;
    static final int TELEGRAM_LIMIT = 4096;

    public String render(Alert alert, ChannelType type) {
        return switch (type) {
            case DINGTALK, WECOM, SERVERCHAN, PUSHPLUS -> renderMarkdown(alert);
            case DISCORD -> truncate(String.format("**%s**\n%s", alert.getTitle(), plainBody(alert)), DISCORD_LIMIT);
            case TELEGRAM -> truncate(alert.getTitle() + "\n\n" + plainBody(alert), TELEGRAM_LIMIT);
            case BARK, LARK, PUSHOVER -> alert.getTitle() + "\n" + plainBody(alert);
        };
    }

    /** Body with the timestamp footer, for channels that carry the title separately. */
    public String plainBody(Alert alert) {
        String content = alert.getContent() == null ? "" : alert.getContent().strip();
        if (alert.getTimestamp() == null) {
            return content;
        }
        return content + "\n\n" + alert.getTimestamp().format(TIME_FORMAT);
    }

    private String renderMarkdown(Alert alert) {
        return String.format("### %s\n\n%s", alert.getTitle(), plainBody(alert));
    }

    private static String truncate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit - 3) + "...";
    }
}
