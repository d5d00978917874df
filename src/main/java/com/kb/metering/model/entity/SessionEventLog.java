package com.kb.metering.model.entity;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * 세션 이벤트 로그 - MongoDB 저장용
 * Kafka 로 전파된 세션 라이프사이클 이벤트의 감사 로그
 */
@Document(collection = "session_events")
@CompoundIndex(def = "{'sessionId': 1, 'timestamp': -1}")
@CompoundIndex(def = "{'eventType': 1, 'timestamp': -1}")
@Data
@Builder
public class SessionEventLog {
    
    @Id
    private String id;
    
    /**
     * 이벤트 고유 ID (인스턴스별 중복 저장 방지)
     */
    @Indexed
    private String eventId;
    
    @Indexed
    private String sessionId;
    
    private String eventType;
    
    private Instant timestamp;
    
    /**
     * 이벤트 관련 사용자 ID
     */
    private String userId;
    
    private String originServerId;
    
    /**
     * 로그를 기록한 서버 ID
     */
    private String recordedBy;
    
    private String priority;
    
    /**
     * 이벤트별 금액/분 등 상세 데이터
     */
    private Map<String, Object> eventData;
    
    /**
     * 문서 생성 시각 (TTL 인덱스용)
     */
    @Indexed(expireAfterSeconds = 31536000) // 1년 후 자동 삭제
    @Builder.Default
    private Instant createdAt = Instant.now();
}
