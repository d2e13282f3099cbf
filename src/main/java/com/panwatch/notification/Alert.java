package com.panwatch.notification;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A message to fan out to notification channels.
 *
 * <p>Built by the agent executor from a classified suggestion (or by a channel test) and
 * rendered per channel by {@link NotificationTemplateEngine}.
 */
@Value
@Builder
public class Alert {

    String agentName;

    /** Headline, e.g. "【盘中监测】贵州茅台（600519） 卖出". */
    String title;

    /** Markdown-ish body. */
    String content;

    LocalDateTime timestamp;
}
