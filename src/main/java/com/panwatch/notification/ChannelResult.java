package com.panwatch.notification;

import lombok.Builder;
import lombok.Value;

/** Outcome of one channel attempt within a dispatch. */
@Value
@Builder
public class ChannelResult {

    Long channelId;
    String channelName;
    boolean success;
    String error;
    long durationMs;
}
