package com.panwatch.notification;

/**
 * Identity of a throttle bucket: one per (agent, instrument), or (agent, "*") for a batch
 * run's consolidated alert.
 */
public record ThrottleKey(String agentName, String instrumentKey) {

    public static final String BATCH = "*";

    public static ThrottleKey of(String agentName, Long instrumentId) {
        return new ThrottleKey(agentName, instrumentId == null ? BATCH : String.valueOf(instrumentId));
    }

    public static ThrottleKey batch(String agentName) {
        return new ThrottleKey(agentName, BATCH);
    }

    @Override
    public String toString() {
        return agentName + ":" + instrumentKey;
    }
}
