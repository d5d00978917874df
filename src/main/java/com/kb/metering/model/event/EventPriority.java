package com.kb.metering.model.event;

/**
 * 이벤트 우선순위
 * 금액에 영향을 주는 이벤트일수록 높게 분류
 */
public enum EventPriority {
    /**
     * 중요 이벤트 - 절대 유실 불가
     * 예: 분 과금, 세션 종료/정산
     */
    CRITICAL,
    
    /**
     * 중간 우선순위 이벤트
     * 예: 예치 승인, 연장, 선물
     */
    IMPORTANT,
    
    /**
     * 일반 이벤트
     * 예: 세션 활성화
     */
    NORMAL
}
