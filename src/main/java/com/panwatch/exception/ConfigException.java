package com.panwatch.exception;

import java.util.Map;

/**
 * Invalid configuration: a malformed schedule, a dangling model/channel reference, or an
 * agent with nothing to run against. Fatal for the run that hit it and never retried; the
 * message is meant for the owner of the agent or instrument.
 */
public class ConfigException extends BaseException {

    public ConfigException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public ConfigException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIG_ERROR, message, details);
    }
}
