package com.panwatch.domain.enums;

/** What started a run. MANUAL covers the UI "run now" and test actions. */
public enum TriggerSource {
    SCHEDULED,
    MANUAL
}
