package com.panwatch.domain.enums;

/**
 * Supported push channels. Each type has exactly one ChannelSender implementation
 * and its own set of required config keys.
 */
public enum ChannelType {
    TELEGRAM,
    BARK,
    DINGTALK,
    WECOM,
    LARK,
    SERVERCHAN,
    PUSHPLUS,
    DISCORD,
    PUSHOVER
}
