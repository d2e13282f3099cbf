package com.panwatch.exception;

/**
 * Delivery to one notification channel failed. Never fails a run; surfaced in the
 * per-channel result instead.
 */
public class ChannelException extends BaseException {

    public ChannelException(String message) {
        super(ErrorCode.CHANNEL_ERROR, message);
    }

    public ChannelException(String message, Throwable cause) {
        super(ErrorCode.CHANNEL_ERROR, message, cause);
    }
}
