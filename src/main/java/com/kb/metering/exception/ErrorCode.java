package com.kb.metering.exception;

import org.springframework.http.HttpStatus;

/**
 * 과금 엔진 오류 분류
 */
public enum ErrorCode {
    /** 잔액 부족 (충전 또는 연장 유도) */
    INSUFFICIENT_FUNDS(HttpStatus.CONFLICT, "잔액이 부족합니다"),
    /** 세션/룸 참여자가 아님 */
    UNAUTHORIZED(HttpStatus.FORBIDDEN, "세션 참여자가 아닙니다"),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "세션을 찾을 수 없습니다"),
    ALREADY_TERMINAL(HttpStatus.CONFLICT, "이미 종료된 세션입니다"),
    /** 연결 끊김 (재접속 유예, 정산하지 않음) */
    CONNECTIVITY_LOST(HttpStatus.SERVICE_UNAVAILABLE, "연결이 끊어졌습니다"),
    /** 하트비트 없음 (세션 강제 종료) */
    LIVENESS_TIMEOUT(HttpStatus.GONE, "하트비트가 없어 세션이 종료되었습니다"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "잘못된 요청입니다");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
