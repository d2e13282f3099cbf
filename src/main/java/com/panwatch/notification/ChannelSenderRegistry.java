package com.panwatch.notification;

import com.panwatch.domain.enums.ChannelType;
import com.panwatch.exception.ChannelException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Looks up the sender bean for a channel type. */
@Component
public class ChannelSenderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelSenderRegistry.class);

    private final Map<ChannelType, ChannelSender> senders = new EnumMap<>(ChannelType.class);

    public ChannelSenderRegistry(List<ChannelSender> channelSenders) {
        for (ChannelSender sender : channelSenders) {
            ChannelSender previous = senders.put(sender.type(), sender);
            if (previous != null) {
                throw new IllegalStateException("Duplicate channel sender for " + sender.type());
            }
        }
        log.info("Registered channel senders: {}", senders.keySet());
    }

    public ChannelSender get(ChannelType type) {
        ChannelSender sender = senders.get(type);
        if (sender == null) {
            throw new ChannelException("No sender registered for channel type " + type);
        }
        return sender;
    }
}
