package com.panwatch.notification;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.domain.model.NotifyChannel;

/**
 * Delivers a rendered alert to one push service.
 *
 * <p>Implementations validate the channel config before any network call and throw
 * {@link com.panwatch.exception.ChannelException} on any failure, including a 2xx response
 * whose body reports an error.
 */
public interface ChannelSender {

    ChannelType type();

    void send(NotifyChannel channel, Alert alert);
}
