package com.kb.metering.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 세션 종료 사유
 */
public enum EndReason {
    NORMAL("normal"),
    INSUFFICIENT_BALANCE("insufficient_balance"),
    LIVENESS_TIMEOUT("liveness_timeout"),
    CANCELLED("cancelled"),
    UNAUTHORIZED_ACCESS("unauthorized_access");

    private final String code;

    EndReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 참여자가 직접 보고할 수 있는 사유인지 (normal, cancelled)
     * 나머지는 서버만 기록한다.
     */
    public boolean isParticipantReportable() {
        return this == NORMAL || this == CANCELLED;
    }

    /**
     * 참여자가 보낸 사유 문자열 변환. 서버 전용 사유나 모르는 값은 normal 로 처리
     */
    public static EndReason fromParticipant(String value) {
        EndReason reason = from(value);
        return reason.isParticipantReportable() ? reason : NORMAL;
    }

    /**
     * 사유 코드 문자열 변환. 모르는 값은 normal 로 처리
     */
    @JsonCreator
    public static EndReason from(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EndReason reason : values()) {
            if (reason.code.equals(normalized)) {
                return reason;
            }
        }
        return NORMAL;
    }
}
