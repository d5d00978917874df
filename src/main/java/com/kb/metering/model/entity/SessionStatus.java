package com.kb.metering.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 세션 상태
 * initialized -> active -> completed, initialized|active -> cancelled
 */
public enum SessionStatus {
    INITIALIZED,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }
}
