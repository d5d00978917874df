package com.kb.metering.exception;

public class SessionNotFoundException extends MeteringException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "세션을 찾을 수 없습니다: " + sessionId);
    }
}
