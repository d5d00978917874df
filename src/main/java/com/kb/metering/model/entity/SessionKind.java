package com.kb.metering.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 세션 종류 (채팅/음성/영상)
 */
public enum SessionKind {
    TEXT("text"),
    VOICE("voice"),
    VIDEO("video");

    private final String code;

    SessionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 요청 문자열을 세션 종류로 변환 ("chat" 은 text 로 취급)
     */
    @JsonCreator
    public static SessionKind from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("세션 종류는 필수입니다");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("chat".equals(normalized)) {
            return TEXT;
        }
        for (SessionKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("알 수 없는 세션 종류: " + value);
    }
}
