package com.kb.metering.exception;

import com.kb.metering.model.entity.SessionStatus;

/**
 * 종료된 세션에 대한 변경 요청
 * 하트비트/종료처럼 중복 호출이 자연스러운 경우 호출부에서 no-op 으로 처리
 */
public class SessionAlreadyTerminalException extends MeteringException {

    private final SessionStatus status;

    public SessionAlreadyTerminalException(String sessionId, SessionStatus status) {
        super(ErrorCode.ALREADY_TERMINAL, "이미 종료된 세션입니다: " + sessionId + " (" + status.getCode() + ")");
        this.status = status;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
