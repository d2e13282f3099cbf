package com.panwatch.domain.enums;

/**
 * How an agent covers its enrolled instruments.
 * BATCH makes one analysis call over all instruments; SINGLE runs each instrument
 * through its own execution so one failure never blocks the others.
 */
public enum ExecutionMode {
    SINGLE,
    BATCH
}
