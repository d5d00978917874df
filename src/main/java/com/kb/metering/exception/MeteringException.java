package com.kb.metering.exception;

import java.util.Collections;
import java.util.Map;

/**
 * 과금 엔진 도메인 예외의 기본 클래스
 */
public class MeteringException extends RuntimeException {

    private final ErrorCode errorCode;

    public MeteringException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MeteringException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 응답 본문에 추가할 필드 (기본 없음)
     */
    public Map<String, Object> getDetails() {
        return Collections.emptyMap();
    }
}
