package com.panwatch.domain.enums;

/**
 * Outcome of one notification fan-out.
 * THROTTLED and NO_CHANNELS are skips, not errors: zero channels were attempted.
 */
public enum DispatchStatus {
    DELIVERED,
    PARTIAL,
    FAILED,
    THROTTLED,
    NO_CHANNELS
}
