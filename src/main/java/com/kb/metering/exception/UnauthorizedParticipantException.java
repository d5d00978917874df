package com.kb.metering.exception;

/**
 * 세션/룸 참여자가 아닌 사용자의 요청
 */
public class UnauthorizedParticipantException extends MeteringException {

    public UnauthorizedParticipantException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
