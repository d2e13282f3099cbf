package com.panwatch.domain.enums;

public enum LogPhase {
    START,
    SUCCESS,
    ERROR
}
